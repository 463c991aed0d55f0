package io.replicheck.checkservice.infra.soa;

/**
 * A SOA configuration file exists but cannot be parsed into the expected structure.
 */
public class SoaConfigurationException extends RuntimeException {

    public SoaConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
