package com.bank.fraud.context.signals;

import com.bank.fraud.model.TransactionMetadata;

import java.util.Optional;

/**
 * Metadata paths read by more than one signal group.
 */
final class MetadataFields {

    private MetadataFields() {}

    static Optional<String> ipAddress(TransactionMetadata metadata) {
        Optional<String> ip = metadata.text("ip_address");
        return ip.isPresent() ? ip : metadata.text("device", "ip_address");
    }

    static Optional<String> deviceId(TransactionMetadata metadata) {
        return metadata.identifier("device", "device_id");
    }

    static Optional<String> email(TransactionMetadata metadata) {
        Optional<String> email = metadata.text("email");
        return email.isPresent() ? email : metadata.text("device", "email");
    }

    static Optional<String> country(TransactionMetadata metadata) {
        return metadata.text("geo", "country");
    }

    static Optional<String> city(TransactionMetadata metadata) {
        return metadata.text("geo", "city");
    }

    static Optional<double[]> coordinates(TransactionMetadata metadata) {
        Optional<Double> lat = metadata.number("geo", "latitude");
        Optional<Double> lon = metadata.number("geo", "longitude");
        if (lat.isEmpty() || lon.isEmpty()) return Optional.empty();
        return Optional.of(new double[]{lat.get(), lon.get()});
    }
}
