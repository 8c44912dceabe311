package com.postcraft.domain.generation.model;

public record ContactInfo(String phone, String email, String website, String address) {

    public boolean isEmpty() {
        return isBlank(phone) && isBlank(email) && isBlank(website) && isBlank(address);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
