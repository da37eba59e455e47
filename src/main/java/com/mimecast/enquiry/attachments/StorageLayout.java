package com.mimecast.enquiry.attachments;

import com.mimecast.enquiry.config.StorageConfig;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDate;
import java.util.Locale;
import java.util.UUID;

/**
 * Date bucketed storage layout.
 *
 * <p>Relative paths take the form <i>{category}/{yyyy}/{mm}/{dd}/{uuid}{ext}</i>.
 * <br>Saved names are random UUIDs so concurrent writers never collide.
 */
public class StorageLayout {

    private final Path root;
    private final String urlPrefix;
    private final String imageDir;
    private final String documentDir;

    /**
     * Constructs a new StorageLayout instance.
     *
     * @param config StorageConfig instance.
     */
    public StorageLayout(StorageConfig config) {
        this.root = Paths.get(config.getRoot());
        this.urlPrefix = config.getUrlPrefix().endsWith("/") ? config.getUrlPrefix() : config.getUrlPrefix() + "/";
        this.imageDir = trimSlashes(config.getImageDir());
        this.documentDir = trimSlashes(config.getDocumentDir());
    }

    /**
     * Generates a saved filename.
     *
     * @param extension Extension with leading dot, may be empty.
     * @return Filename.
     */
    public String newFilename(String extension) {
        return UUID.randomUUID() + (extension != null ? extension : "");
    }

    /**
     * Gets category directory.
     *
     * @param type AttachmentType.
     * @return Directory relative to root.
     */
    public String getCategoryDir(AttachmentType type) {
        return type == AttachmentType.IMAGE ? imageDir : documentDir;
    }

    /**
     * Gets relative path with forward slashes.
     *
     * @param type          AttachmentType.
     * @param date          Processing date.
     * @param savedFilename Saved filename.
     * @return Relative path.
     */
    public String relativePath(AttachmentType type, LocalDate date, String savedFilename) {
        return String.format(Locale.ROOT, "%s/%04d/%02d/%02d/%s",
                getCategoryDir(type), date.getYear(), date.getMonthValue(), date.getDayOfMonth(), savedFilename);
    }

    /**
     * Resolves a relative path under the storage root.
     *
     * @param relativePath Relative path.
     * @return Path instance.
     */
    public Path resolve(String relativePath) {
        return root.resolve(relativePath);
    }

    /**
     * Gets public URL.
     *
     * @param relativePath Relative path.
     * @return URL.
     */
    public String url(String relativePath) {
        return urlPrefix + relativePath;
    }

    public Path getRoot() {
        return root;
    }

    private static String trimSlashes(String value) {
        String trimmed = value;
        while (trimmed.startsWith("/")) {
            trimmed = trimmed.substring(1);
        }
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }
}
