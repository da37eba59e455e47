/**
 * Body sanitising and rendering.
 *
 * <p>Plain bodies pass through a fixed chain before display:
 * <ol>
 *     <li>{@link com.mimecast.enquiry.body.BannerStripper} drops injected external mail warnings.</li>
 *     <li>{@link com.mimecast.enquiry.body.LinkStripper} drops auto-linked <i>&lt;https://...&gt;</i> artifacts.</li>
 *     <li>{@link com.mimecast.enquiry.body.ParagraphReconstructor} rebuilds paragraphs from flat lines.</li>
 *     <li>{@link com.mimecast.enquiry.body.PlainTextHtmlFormatter} escapes and separates replies.</li>
 *     <li>{@link com.mimecast.enquiry.body.QuoteWrapper} wraps quoted blocks.</li>
 * </ol>
 *
 * <p>{@link com.mimecast.enquiry.body.BodyRenderer} picks the steps per {@link com.mimecast.enquiry.body.BodyMode}.
 */
package com.mimecast.enquiry.body;
