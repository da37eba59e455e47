/**
 * Upload validation for email files.
 *
 * <p>Failures are reported as a {@link com.mimecast.enquiry.validation.ValidationResult}
 * carrying a message and an {@link com.mimecast.enquiry.validation.ErrorType}.
 */
package com.mimecast.enquiry.validation;
