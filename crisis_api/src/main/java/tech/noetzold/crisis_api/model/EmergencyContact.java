package tech.noetzold.crisis_api.model;

public record EmergencyContact(
        String name,
        String number,
        String available
) {}
