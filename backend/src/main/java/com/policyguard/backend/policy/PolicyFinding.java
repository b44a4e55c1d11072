package com.policyguard.backend.policy;

/** A repository failing one policy. {@code policyType} is the canonical evaluator tag. */
public record PolicyFinding(String policyType, String detail) {}
