package com.mimecast.enquiry.headers;

import java.util.ArrayList;
import java.util.List;

/**
 * Recipient list normaliser.
 *
 * <p>Turns a semicolon separated recipient field into <i>Name &lt;email&gt;; email; raw entry</i> form.
 */
public class RecipientFormatter {

    /**
     * Output separator.
     */
    public static final String SEPARATOR = "; ";

    /**
     * Protected constructor.
     */
    private RecipientFormatter() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Formats a recipient field.
     *
     * @param recipients Semicolon separated recipients, may be null.
     * @return Formatted list or empty string.
     */
    public static String format(String recipients) {
        if (recipients == null || recipients.isEmpty()) {
            return "";
        }

        List<String> list = new ArrayList<>();
        for (String entry : recipients.split(";")) {
            entry = entry.trim();
            if (entry.isEmpty()) {
                continue;
            }

            AddressParser.Parsed parsed = AddressParser.parse(entry);
            if (parsed.hasName() && parsed.hasAddress()) {
                list.add(parsed.getName() + " <" + parsed.getAddress() + ">");
            } else if (parsed.hasAddress()) {
                list.add(parsed.getAddress());
            } else {
                list.add(entry);
            }
        }

        return String.join(SEPARATOR, list);
    }
}
