package com.policyguard.backend.github;

public record RemoteRepository(long id, String name, String fullName, boolean archived) {}
