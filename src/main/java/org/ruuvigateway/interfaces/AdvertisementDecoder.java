package org.ruuvigateway.interfaces;

import org.ruuvigateway.model.Advertisement;
import org.ruuvigateway.model.AdvertisementDecodeException;

/** Decodes raw advertisement bytes into a structured advertisement. */
@FunctionalInterface
public interface AdvertisementDecoder {
    Advertisement decode(byte[] payload) throws AdvertisementDecodeException;
}
