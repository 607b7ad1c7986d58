package uk.gegc.creditledger.features.usage.api.dto;

public record UsageBreakdownDto(
        String serviceType,
        String model,
        String provider,
        long requestCount,
        long creditsCharged,
        long unitsReported
) {}
