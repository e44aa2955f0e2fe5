package com.sarcodec.cphd;

import com.sarcodec.data.PayloadArray;
import com.sarcodec.error.SarCodecException;
import com.sarcodec.xml.XmlTrees;
import org.jdom2.Document;

import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * A one-channel CPHD with a support array, four vectors of five samples and a 64-byte PVP
 * record.
 */
final class CphdTestData {
    static final String NAMESPACE = "http://api.nsgreg.nga.mil/schema/cphd/1.1.0";
    static final int VECTORS = 4;
    static final int SAMPLES = 5;

    static final String CHANNEL_1 = "<Channel><Identifier>1</Identifier><NumVectors>4</NumVectors>"
            + "<NumSamples>5</NumSamples><SignalArrayByteOffset>0</SignalArrayByteOffset>"
            + "<PVPArrayByteOffset>0</PVPArrayByteOffset></Channel>";

    private CphdTestData() {
    }

    static Document cphdXml() throws SarCodecException {
        return cphdXml(NAMESPACE, CHANNEL_1);
    }

    static Document cphdXml(String namespace, String channels) throws SarCodecException {
        var text = "<?xml version=\"1.0\" encoding=\"UTF-8\"?>"
                + "<CPHD xmlns=\"" + namespace + "\">"
                + "<CollectionID><CollectorName>Synthetic</CollectorName>"
                + "<Classification>UNCLASSIFIED</Classification></CollectionID>"
                + "<Data>"
                + "<SignalArrayFormat>CF8</SignalArrayFormat>"
                + "<NumBytesPVP>64</NumBytesPVP>"
                + channels
                + "<SupportArray><Identifier>AntPattern</Identifier><NumRows>3</NumRows><NumCols>2</NumCols>"
                + "<BytesPerElement>8</BytesPerElement><ArrayByteOffset>0</ArrayByteOffset></SupportArray>"
                + "</Data>"
                + "<PVP>"
                + "<TxTime><Offset>0</Offset><Size>1</Size><Format>F8</Format></TxTime>"
                + "<TxPos><Offset>1</Offset><Size>3</Size><Format>X=F8;Y=F8;Z=F8;</Format></TxPos>"
                + "<SIGNAL><Offset>4</Offset><Size>1</Size><Format>I8</Format></SIGNAL>"
                + "<AddedPVP><Name>Gain</Name><Offset>5</Offset><Size>1</Size><Format>F8</Format></AddedPVP>"
                + "</PVP>"
                + "<SupportArray><AntGainPhase><Identifier>AntPattern</Identifier>"
                + "<ElementFormat>Gain=F4;Phase=F4;</ElementFormat></AntGainPhase></SupportArray>"
                + "</CPHD>";
        return XmlTrees.parse(text.getBytes(StandardCharsets.UTF_8));
    }

    static CphdPlan plan(Document cphdXml) {
        return CphdPlan.builder()
                .cphdXml(cphdXml)
                .fileHeader(CphdFileHeaderFields.builder()
                        .classification("UNCLASSIFIED")
                        .releaseInfo("UNRESTRICTED")
                        .additionalKvps(Map.of("PRODUCER", "sarcodec tests"))
                        .build())
                .build();
    }

    static PayloadArray signal(CphdStructure structure, int vectors, int samples) {
        var signal = PayloadArray.allocate(structure.getSignalType(), vectors, samples);
        for (int i = 0; i < vectors * samples; i++) {
            signal.setComplex(i, i, 0.25 * i);
        }
        return signal;
    }

    static PayloadArray pvps(CphdStructure structure, int vectors) {
        var pvps = PayloadArray.allocate(structure.getPvpType(), vectors);
        for (int i = 0; i < vectors; i++) {
            pvps.setField(i, "TxTime", 0.001 * i);
            pvps.setField(i, "TxPos.X", 7000e3 + i);
            pvps.setField(i, "TxPos.Y", -12.5 * i);
            pvps.setField(i, "TxPos.Z", 3.0);
            pvps.setFieldLong(i, "SIGNAL", 1L);
            pvps.setField(i, "Gain", 1.5);
        }
        return pvps;
    }

    static PayloadArray antennaPattern(CphdStructure structure) {
        var array = PayloadArray.allocate(structure.supportArray("AntPattern").orElseThrow().getElementType(), 3, 2);
        for (int i = 0; i < 6; i++) {
            array.setField(i, "Gain", -i);
            array.setField(i, "Phase", 0.5 * i);
        }
        return array;
    }
}
