package io.crosslane.json;

public class Views {
    public static class Default {}

    // Adds fields only relayer tooling needs, such as raw payloads
    public static class Extended extends Default {}
}
