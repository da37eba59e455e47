package com.mimecast.enquiry.enquiry;

import java.util.List;

/**
 * Member lookup.
 */
public interface MemberDirectory {

    /**
     * Finds active members by email address, case-insensitive.
     *
     * @param email Email address.
     * @return List of Member, empty if none.
     */
    List<Member> findActiveByEmail(String email);
}
