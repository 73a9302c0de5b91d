package org.ruuvigateway.decode;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.ruuvigateway.interfaces.AdvertisementDecoder;
import org.ruuvigateway.model.Advertisement;
import org.ruuvigateway.model.AdvertisementDecodeException;

/**
 * Decodes a Bluetooth LE advertisement as a sequence of GAP AD structures
 * ({@code length, type, data[length - 1]}).
 * <p>
 * Only the generic structures are interpreted. Manufacturer and service data are
 * returned raw for beacon-format specific decoders to handle.
 */
public final class GapAdvertisementDecoder implements AdvertisementDecoder {

    static final int TYPE_FLAGS = 0x01;
    static final int TYPE_UUID16_INCOMPLETE = 0x02;
    static final int TYPE_UUID16_COMPLETE = 0x03;
    static final int TYPE_UUID32_INCOMPLETE = 0x04;
    static final int TYPE_UUID32_COMPLETE = 0x05;
    static final int TYPE_UUID128_INCOMPLETE = 0x06;
    static final int TYPE_UUID128_COMPLETE = 0x07;
    static final int TYPE_NAME_SHORT = 0x08;
    static final int TYPE_NAME_COMPLETE = 0x09;
    static final int TYPE_TX_POWER = 0x0A;
    static final int TYPE_SERVICE_DATA_UUID16 = 0x16;
    static final int TYPE_SERVICE_DATA_UUID32 = 0x20;
    static final int TYPE_SERVICE_DATA_UUID128 = 0x21;
    static final int TYPE_MANUFACTURER_DATA = 0xFF;

    private static final String BASE_UUID_SUFFIX = "-0000-1000-8000-00805f9b34fb";

    @Override
    public Advertisement decode(byte[] payload) throws AdvertisementDecodeException {
        if (payload == null || payload.length == 0) {
            throw new AdvertisementDecodeException("Empty advertisement");
        }
        Integer flags = null;
        String localName = null;
        Integer txPower = null;
        List<String> uuids = new ArrayList<>();
        Map<String, byte[]> serviceData = new LinkedHashMap<>();
        Map<Integer, byte[]> manufacturerData = new LinkedHashMap<>();

        int pos = 0;
        while (pos < payload.length) {
            int len = payload[pos] & 0xFF;
            if (len == 0) {
                break; // zero padding up to the PDU length
            }
            if (pos + 1 + len > payload.length) {
                throw new AdvertisementDecodeException(
                        "AD structure at offset " + pos + " declares " + len + " bytes but only "
                                + (payload.length - pos - 1) + " remain");
            }
            int type = payload[pos + 1] & 0xFF;
            byte[] data = Arrays.copyOfRange(payload, pos + 2, pos + 1 + len);

            switch (type) {
                case TYPE_FLAGS -> flags = data.length > 0 ? data[0] & 0xFF : 0;
                case TYPE_UUID16_INCOMPLETE, TYPE_UUID16_COMPLETE -> addUuids(uuids, data, 2);
                case TYPE_UUID32_INCOMPLETE, TYPE_UUID32_COMPLETE -> addUuids(uuids, data, 4);
                case TYPE_UUID128_INCOMPLETE, TYPE_UUID128_COMPLETE -> addUuids(uuids, data, 16);
                case TYPE_NAME_SHORT -> {
                    if (localName == null) {
                        localName = new String(data, StandardCharsets.UTF_8);
                    }
                }
                case TYPE_NAME_COMPLETE -> localName = new String(data, StandardCharsets.UTF_8);
                case TYPE_TX_POWER -> {
                    if (data.length > 0) {
                        txPower = (int) data[0];
                    }
                }
                case TYPE_SERVICE_DATA_UUID16 -> putServiceData(serviceData, data, 2);
                case TYPE_SERVICE_DATA_UUID32 -> putServiceData(serviceData, data, 4);
                case TYPE_SERVICE_DATA_UUID128 -> putServiceData(serviceData, data, 16);
                case TYPE_MANUFACTURER_DATA -> {
                    if (data.length < 2) {
                        throw new AdvertisementDecodeException("Manufacturer data shorter than company id");
                    }
                    int company = (data[0] & 0xFF) | ((data[1] & 0xFF) << 8);
                    manufacturerData.put(company, Arrays.copyOfRange(data, 2, data.length));
                }
                default -> {
                    // unknown AD types are skipped
                }
            }
            pos += 1 + len;
        }
        return new Advertisement(flags, localName, uuids, serviceData, manufacturerData, txPower);
    }

    private static void addUuids(List<String> out, byte[] data, int width) throws AdvertisementDecodeException {
        if (data.length % width != 0) {
            throw new AdvertisementDecodeException("UUID list length " + data.length + " is not a multiple of " + width);
        }
        for (int i = 0; i < data.length; i += width) {
            out.add(uuidOf(data, i, width));
        }
    }

    private static void putServiceData(Map<String, byte[]> out, byte[] data, int width)
            throws AdvertisementDecodeException {
        if (data.length < width) {
            throw new AdvertisementDecodeException("Service data shorter than its UUID");
        }
        out.put(uuidOf(data, 0, width), Arrays.copyOfRange(data, width, data.length));
    }

    /** AD fields are little-endian; 16/32-bit UUIDs expand onto the Bluetooth base UUID. */
    static String uuidOf(byte[] data, int offset, int width) {
        StringBuilder hex = new StringBuilder(32);
        for (int i = offset + width - 1; i >= offset; i--) {
            hex.append(String.format("%02x", data[i] & 0xFF));
        }
        if (width == 16) {
            return hex.substring(0, 8) + "-" + hex.substring(8, 12) + "-" + hex.substring(12, 16)
                    + "-" + hex.substring(16, 20) + "-" + hex.substring(20);
        }
        String prefix = (width == 2) ? "0000" + hex : hex.toString();
        return prefix + BASE_UUID_SUFFIX;
    }
}
