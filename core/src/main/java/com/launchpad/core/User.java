package com.launchpad.core;

/**
 * A person who can book trips. The id is assigned by the identity store, the email is the natural key.
 * Anonymous identities created without an email carry a null email.
 */
public record User(
        String id,
        String email
) {}
