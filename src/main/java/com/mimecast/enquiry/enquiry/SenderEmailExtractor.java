package com.mimecast.enquiry.enquiry;

import com.mimecast.enquiry.ParsedEmail;
import com.mimecast.enquiry.headers.AddressParser;
import org.apache.commons.validator.routines.EmailValidator;

import java.util.Optional;

/**
 * Pulls the bare sender address out of a parsed email.
 *
 * <p>The canonical sender is tried first, then the raw sender field.
 */
public class SenderEmailExtractor {

    /**
     * Protected constructor.
     */
    private SenderEmailExtractor() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Extracts sender address.
     *
     * @param email ParsedEmail instance.
     * @return Optional of String.
     */
    public static Optional<String> extract(ParsedEmail email) {
        if (email == null) {
            return Optional.empty();
        }

        Optional<String> address = extract(email.getEmailFrom());
        return address.isPresent() ? address : extract(email.getRawFrom());
    }

    /**
     * Extracts address from a sender field.
     *
     * @param sender Sender field, may be null.
     * @return Optional of String.
     */
    public static Optional<String> extract(String sender) {
        if (sender == null || sender.isBlank()) {
            return Optional.empty();
        }

        String address = AddressParser.parse(sender).getAddress();
        if (!address.isEmpty() && EmailValidator.getInstance().isValid(address)) {
            return Optional.of(address);
        }

        return Optional.empty();
    }
}
