package org.ruuvigateway;

import org.ruuvigateway.decode.GapAdvertisementDecoder;
import org.ruuvigateway.decode.HexCodec;
import org.ruuvigateway.model.Advertisement;
import org.ruuvigateway.model.AdvertisementDecodeException;
import org.ruuvigateway.model.BeaconRecord;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class GapAdvertisementDecoderTest {

    private final GapAdvertisementDecoder decoder = new GapAdvertisementDecoder();

    @Test
    void flagsAndSixteenBitServiceUuid() throws Exception {
        Advertisement ad = decoder.decode(HexCodec.decode("0201060303aafe"));
        assertEquals(6, ad.getFlags().getAsInt());
        assertEquals(1, ad.getServiceUuids().size());
        assertEquals("0000feaa-0000-1000-8000-00805f9b34fb", ad.getServiceUuids().get(0));
        assertTrue(ad.getManufacturerData().isEmpty());
    }

    @Test
    void ruuviManufacturerDataIsKeyedByCompanyId() throws Exception {
        Advertisement ad = decoder.decode(HexCodec.decode(GatewayFixtures.RUUVI_RAW));
        byte[] m = ad.getManufacturerData().get(0x0499);
        assertNotNull(m, "company 0x0499 missing: " + ad);
        assertEquals(24, m.length);
        assertEquals(0x05, m[0]); // RAWv2 format byte
    }

    @Test
    void nameTxPowerAndServiceData() throws Exception {
        // name "Ruuvi", tx power -4, service data for 0xFEAA = 10 20
        Advertisement ad = decoder.decode(HexCodec.decode("06095275757669" + "020afc" + "0516aafe1020"));
        assertEquals("Ruuvi", ad.getLocalName().orElseThrow());
        assertEquals(-4, ad.getTxPower().getAsInt());
        assertArrayEquals(new byte[]{0x10, 0x20}, ad.getServiceData().get("0000feaa-0000-1000-8000-00805f9b34fb"));
    }

    @Test
    void zeroPaddingEndsParsing() throws Exception {
        Advertisement ad = decoder.decode(HexCodec.decode("020106000000"));
        assertEquals(6, ad.getFlags().getAsInt());
    }

    @Test
    void truncatedStructureFails() {
        assertThrows(AdvertisementDecodeException.class, () -> decoder.decode(HexCodec.decode("0201060503aafe")));
        assertThrows(AdvertisementDecodeException.class, () -> decoder.decode(new byte[0]));
        assertThrows(AdvertisementDecodeException.class, () -> decoder.decode(HexCodec.decode("0303aa")));
    }

    @Test
    void recordDelegatesToTheSuppliedDecoder() throws Exception {
        BeaconRecord rec = new BeaconRecord("11:22:33:44:55:66", -70, 95, HexCodec.decode("0201060303aafe"), 5L);
        assertEquals(6, rec.parseAnnouncement(decoder).getFlags().getAsInt());

        Advertisement stub = new Advertisement(null, "stub", List.of(), Map.of(), Map.of(), null);
        assertSame(stub, rec.parseAnnouncement(payload -> stub));
    }
}
