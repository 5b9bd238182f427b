package eti.domain.discovery;

import eti.common.ETransportType;

import java.util.Objects;

/**
 * A discovered printer. Identity is the address.
 * @since 16/10/2026
 */
public record PrinterDevice(
        String address,
        String name,
        ETransportType transportType,
        boolean connected,
        String status) {

    public PrinterDevice {
        Objects.requireNonNull(address, "address");
        name = name != null ? name : address;
    }

    public static PrinterDevice network(String address, String name) {
        return new PrinterDevice(address, name, ETransportType.NETWORK, false, "Found");
    }

    public static PrinterDevice bluetooth(String address, String name) {
        return new PrinterDevice(address, name, ETransportType.BLUETOOTH, false, "Found");
    }

    public PrinterDevice withConnected(boolean isConnected) {
        return new PrinterDevice(address, name, transportType, isConnected, isConnected ? "Connected" : status);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PrinterDevice other)) {
            return false;
        }
        return address.equals(other.address);
    }

    @Override
    public int hashCode() {
        return address.hashCode();
    }
}
