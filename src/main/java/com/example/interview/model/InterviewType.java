package com.example.interview.model;

public enum InterviewType {
    PHONE_SCREEN,
    VIDEO_CALL,
    TECHNICAL,
    BEHAVIORAL,
    PANEL,
    ONSITE,
    FINAL;

    /** "PHONE_SCREEN" -> "Phone Screen" */
    public String displayName() {
        String[] parts = name().toLowerCase().split("_");
        StringBuilder sb = new StringBuilder();
        for (String part : parts) {
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(Character.toUpperCase(part.charAt(0))).append(part.substring(1));
        }
        return sb.toString();
    }
}
