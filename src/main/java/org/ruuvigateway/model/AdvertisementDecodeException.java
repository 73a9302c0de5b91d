package org.ruuvigateway.model;

/** Raised when raw advertisement bytes cannot be decoded. */
public class AdvertisementDecodeException extends Exception {
    public AdvertisementDecodeException(String message) {
        super(message);
    }
}
