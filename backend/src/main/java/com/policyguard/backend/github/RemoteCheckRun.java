package com.policyguard.backend.github;

public record RemoteCheckRun(long id, String name) {}
