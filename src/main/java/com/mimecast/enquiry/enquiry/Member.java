package com.mimecast.enquiry.enquiry;

/**
 * Council member as known to the enquiry system.
 */
public class Member {

    private final long id;
    private final String fullName;
    private final String email;
    private final boolean active;

    /**
     * Constructs a new Member instance.
     *
     * @param id       Member id.
     * @param fullName Full name.
     * @param email    Email address.
     * @param active   Whether the member is active.
     */
    public Member(long id, String fullName, String email, boolean active) {
        this.id = id;
        this.fullName = fullName;
        this.email = email;
        this.active = active;
    }

    public long getId() {
        return id;
    }

    public String getFullName() {
        return fullName;
    }

    public String getEmail() {
        return email;
    }

    public boolean isActive() {
        return active;
    }
}
