package com.mimecast.enquiry.headers;

/**
 * Traffic direction relative to the monitored inbox.
 */
public enum Direction {
    INCOMING,
    OUTGOING
}
