/**
 * File operations audit log.
 *
 * <p>{@link com.mimecast.enquiry.logging.FileOperationsLog} is handed to components that touch storage.
 * <br>{@link com.mimecast.enquiry.logging.Log4jFileOperationsLog} routes entries to the <i>file_operations</i> logger
 * configured in <i>log4j2.xml</i>.
 */
package com.mimecast.enquiry.logging;
