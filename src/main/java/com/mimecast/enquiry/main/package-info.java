/**
 * Command line entry point and static configuration holder.
 *
 * <p>Options:
 * <ul>
 *     <li><b>--file</b> Container file to parse.</li>
 *     <li><b>--mode</b> <i>snippet</i>, <i>plain</i> or <i>full</i>.</li>
 *     <li><b>--skip-attachments</b> Parse without writing attachments.</li>
 *     <li><b>--config</b> JSON5 parser configuration.</li>
 *     <li><b>--history</b> Add the history entry view of the message.</li>
 * </ul>
 */
package com.mimecast.enquiry.main;
