/**
 * Container capability.
 *
 * <p>The binary mail container decoder is treated as a black box behind {@link com.mimecast.enquiry.container.ContainerReader}.
 * <br>It yields a {@link com.mimecast.enquiry.container.MailContainer} exposing every field as optional.
 *
 * <p>The default reader for Outlook <i>.msg</i> files is {@link com.mimecast.enquiry.container.msg.PoiMsgContainerReader}
 * <br>which adapts Apache POI HSMF.
 */
package com.mimecast.enquiry.container;
