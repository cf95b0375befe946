package io.meteredbatch.registry;

public record RegistryStats(int total, int success, int failed) {}
