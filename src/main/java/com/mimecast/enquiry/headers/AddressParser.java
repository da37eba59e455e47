package com.mimecast.enquiry.headers;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.mail.internet.AddressException;
import javax.mail.internet.InternetAddress;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lenient single address parser.
 *
 * <p>Splits <i>Name &lt;email&gt;</i>, <i>"Last, First" &lt;email&gt;</i> and bare addresses into parts.
 * <br>Never throws; unparseable input yields an empty result.
 */
public class AddressParser {
    private static final Logger log = LogManager.getLogger(AddressParser.class);

    /**
     * Angle bracket address fallback for input javax.mail rejects.
     */
    private static final Pattern ANGLE_ADDRESS = Pattern.compile("^(.*?)<([^<>@\\s]+@[^<>\\s]+)>\\s*$");

    /**
     * Parsed address parts.
     */
    public static final class Parsed {
        private final String name;
        private final String address;

        Parsed(String name, String address) {
            this.name = name != null ? name.trim() : "";
            this.address = address != null ? address.trim() : "";
        }

        /**
         * Gets display name, empty if none.
         *
         * @return String.
         */
        public String getName() {
            return name;
        }

        /**
         * Gets email address, empty if none.
         *
         * @return String.
         */
        public String getAddress() {
            return address;
        }

        public boolean hasName() {
            return !name.isEmpty();
        }

        public boolean hasAddress() {
            return !address.isEmpty();
        }
    }

    /**
     * Protected constructor.
     */
    private AddressParser() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Parses a single address entry.
     *
     * @param entry Address string.
     * @return Parsed instance, never null.
     */
    public static Parsed parse(String entry) {
        if (entry == null || entry.isBlank()) {
            return new Parsed("", "");
        }

        try {
            InternetAddress address = new InternetAddress(entry.trim(), false);
            if (address.getAddress() != null && address.getAddress().contains("@")) {
                return new Parsed(address.getPersonal(), address.getAddress());
            }
        } catch (AddressException e) {
            log.debug("Lenient address fallback for [{}]: {}", entry, e.getMessage());
        }

        Matcher matcher = ANGLE_ADDRESS.matcher(entry.trim());
        if (matcher.matches()) {
            return new Parsed(stripQuotes(matcher.group(1).trim()), matcher.group(2));
        }

        return new Parsed("", "");
    }

    private static String stripQuotes(String name) {
        if (name.length() >= 2 && name.startsWith("\"") && name.endsWith("\"")) {
            return name.substring(1, name.length() - 1);
        }
        return name;
    }
}
