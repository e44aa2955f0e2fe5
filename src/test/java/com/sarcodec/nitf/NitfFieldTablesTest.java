package com.sarcodec.nitf;

import com.sarcodec.error.SarCodecException;
import com.sarcodec.header.HeaderFieldCodec;
import com.sarcodec.header.HeaderFields;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.*;

class NitfFieldTablesTest {

    @Test
    void shouldPlaceHeaderLengthAtFixedOffset() throws SarCodecException {
        var values = new HeaderFields().put("FL", 1000L).put("HL", 388L);

        var bytes = HeaderFieldCodec.encode(NitfFieldTables.FILE_HEADER, values);

        assertThat(bytes).hasSize(388);
        assertThat(HeaderFieldCodec.decodeField(NitfFieldTables.HL, bytes, NitfFieldTables.HL_OFFSET, 0)).isEqualTo(388L);
        assertThat(new String(bytes, 0, 9, StandardCharsets.ISO_8859_1)).isEqualTo("NITF02.10");
    }

    @Test
    void shouldGrowFileHeaderPerSegment() throws SarCodecException {
        var values = new HeaderFields()
                .put("NUMI", 2L).put("LISH001", 512L).put("LI001", 10L).put("LISH002", 512L).put("LI002", 20L)
                .put("NUMDES", 1L).put("LDSH001", 1000L).put("LD001", 30L);

        var bytes = HeaderFieldCodec.encode(NitfFieldTables.FILE_HEADER, values);
        var decoded = HeaderFieldCodec.decode(NitfFieldTables.FILE_HEADER, bytes, 0);

        assertThat(bytes).hasSize(388 + 2 * 16 + 13);
        assertThat(decoded.getLong("LI002")).isEqualTo(20L);
        assertThat(decoded.getLong("LD001")).isEqualTo(30L);
    }

    @Test
    void shouldUseXmlDataContentSubheaderOnlyWithItsLength() throws SarCodecException {
        var values = new HeaderFields()
                .put("DESID", NitfFieldTables.XML_DATA_CONTENT)
                .put("DESSHL", (long) NitfFieldTables.XML_DATA_CONTENT_DESSHL)
                .put("DESSHTN", "urn:SICD:1.3.0");

        var bytes = HeaderFieldCodec.encode(NitfFieldTables.DES_SUBHEADER, values);
        var decoded = HeaderFieldCodec.decode(NitfFieldTables.DES_SUBHEADER, bytes, 0);

        assertThat(bytes).hasSize(2 + 25 + 2 + 167 + 4 + NitfFieldTables.XML_DATA_CONTENT_DESSHL);
        assertThat(decoded.getString("DESSHTN")).isEqualTo("urn:SICD:1.3.0");
        assertThat(decoded.getLong("DESCRC")).isEqualTo(99999L);
        assertThat(decoded.getString("DESSHFT")).isEqualTo("XML");
    }

    @Test
    void shouldPrefixSecurityFields() {
        var fields = NitfFieldTables.securityFields("IS");

        assertThat(fields).hasSize(16);
        assertThat(fields.get(0).getName()).isEqualTo("ISCLAS");
        assertThat(fields.get(15).getName()).isEqualTo("ISCTLN");
    }
}
