package com.sarcodec.sicd;

import com.sarcodec.data.PayloadArray;
import com.sarcodec.error.SarCodecException;
import com.sarcodec.io.ByteArraySource;
import com.sarcodec.io.ByteSource;
import com.sarcodec.xml.XmlHelper;
import org.jdom2.Document;
import org.jdom2.Element;

import java.io.EOFException;
import java.nio.ByteBuffer;
import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

/**
 * Small synthetic SICD products for tests.
 */
final class SicdTestData {
    static final String NAMESPACE = "urn:SICD:1.3.0";
    static final String FTITLE = "SARkit example SICD FTITLE";
    static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T12:00:00Z"), ZoneOffset.UTC);
    static final double[][] CORNERS = {{39.76, -104.76}, {39.76, -104.74}, {39.74, -104.74}, {39.74, -104.76}};

    private SicdTestData() {
    }

    static Document sicdXml(PixelType pixelType, int numRows, int numCols) throws SarCodecException {
        var document = new Document(new Element("SICD", NAMESPACE));
        var xml = new XmlHelper(document, SicdTranscoders.create());
        xml.set("./{*}CollectionInfo/{*}CollectorName", "Synthetic");
        xml.set("./{*}CollectionInfo/{*}CoreName", "TEST_CORE");
        xml.set("./{*}CollectionInfo/{*}Classification", "UNCLASSIFIED");
        xml.set("./{*}ImageData/{*}PixelType", pixelType.name());
        xml.set("./{*}ImageData/{*}NumRows", (long) numRows);
        xml.set("./{*}ImageData/{*}NumCols", (long) numCols);
        xml.set("./{*}ImageData/{*}FirstRow", 0L);
        xml.set("./{*}ImageData/{*}FirstCol", 0L);
        xml.set("./{*}ImageData/{*}FullImage/{*}NumRows", (long) numRows);
        xml.set("./{*}ImageData/{*}FullImage/{*}NumCols", (long) numCols);
        xml.set("./{*}ImageData/{*}SCPPixel", new long[]{numRows / 2, numCols / 2});
        xml.set("./{*}GeoData/{*}EarthModel", "WGS_84");
        xml.set("./{*}GeoData/{*}SCP/{*}LLH", new double[]{39.75, -104.75, 1650.0});
        xml.set("./{*}GeoData/{*}ImageCorners", CORNERS);
        xml.set("./{*}Timeline/{*}CollectStart", OffsetDateTime.of(2024, 4, 30, 18, 5, 0, 0, ZoneOffset.UTC));
        return document;
    }

    static SicdNitfPlan plan(Document sicdXml) {
        var unclassified = SicdNitfSecurityFields.of("U");
        return SicdNitfPlan.builder()
                .sicdXml(sicdXml)
                .headerFields(SicdNitfHeaderFields.builder()
                        .ostaid("ostaid")
                        .ftitle(FTITLE)
                        .security(unclassified)
                        .build())
                .imageSegmentFields(SicdNitfImageSegmentFields.builder()
                        .isorce("isorce")
                        .security(unclassified)
                        .icom(List.of("first comment"))
                        .build())
                .desFields(SicdNitfDesFields.builder()
                        .security(unclassified)
                        .desshrp("producer")
                        .build())
                .build();
    }

    static SicdNitfPlanner planner() {
        return new SicdNitfPlanner(SicdTranscoders.create(), CLOCK);
    }

    /**
     * Pixels whose value encodes their position, so misplaced rows or columns are detected.
     */
    static PayloadArray pixels(PixelType pixelType, int numRows, int numCols) {
        var pixels = PayloadArray.allocate(pixelType.getDataType(), numRows, numCols);
        for (int i = 0; i < numRows * numCols; i++) {
            switch (pixelType) {
                case RE32F_IM32F:
                    pixels.setComplex(i, i + 0.5, -i);
                    break;
                case RE16I_IM16I:
                    pixels.setField(i, "real", i);
                    pixels.setField(i, "imag", -i);
                    break;
                default:
                    pixels.setComponent(i, 0, i % 256);
                    pixels.setComponent(i, 1, (7 * i) % 256);
                    break;
            }
        }
        return pixels;
    }

    /**
     * Records every byte range a reader asks for.
     */
    static final class RecordingSource implements ByteSource {
        private final ByteArraySource delegate;
        final List<long[]> reads = new ArrayList<>();

        RecordingSource(byte[] bytes) {
            this.delegate = new ByteArraySource(bytes, "recording");
        }

        @Override
        public long size() {
            return delegate.size();
        }

        @Override
        public ByteBuffer read(long offset, int length) throws EOFException {
            reads.add(new long[]{offset, offset + length});
            return delegate.read(offset, length);
        }

        @Override
        public String getSourceIdentifier() {
            return delegate.getSourceIdentifier();
        }

        @Override
        public void close() {
            delegate.close();
        }
    }
}
