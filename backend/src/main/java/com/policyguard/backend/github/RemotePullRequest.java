package com.policyguard.backend.github;

public record RemotePullRequest(int number, String headSha) {}
