/**
 * Typed configuration.
 *
 * <p>Configuration is read from JSON5 files into maps and accessed through classes extending
 * {@link com.mimecast.enquiry.config.ConfigFoundation}.
 * <br>Every accessor carries its own default so an empty file yields a working parser.
 *
 * <p>Example <i>parser.json5</i>:
 * <pre>
 * {
 *   inboxAddress: "memberenquiries@redcar-cleveland.gov.uk",
 *   localTimezone: "Europe/London",
 *   storage: { root: "/var/lib/enquiries/media", urlPrefix: "/media/" },
 *   image: { maxSizeMb: 2, maxDimension: 2048, quality: 85 }
 * }
 * </pre>
 *
 * @see com.mimecast.enquiry.config.ParserConfig
 */
package com.mimecast.enquiry.config;
