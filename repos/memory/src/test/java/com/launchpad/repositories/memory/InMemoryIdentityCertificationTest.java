package com.launchpad.repositories.memory;

import com.launchpad.repos.certification.IdentityCertification;

public class InMemoryIdentityCertificationTest extends IdentityCertification {

    @Override
    public void init() {
        this.identity = new InMemoryIdentity();
    }
}
