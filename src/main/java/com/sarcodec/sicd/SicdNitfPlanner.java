package com.sarcodec.sicd;

import com.sarcodec.error.ErrorType;
import com.sarcodec.error.SarCodecException;
import com.sarcodec.header.HeaderFieldCodec;
import com.sarcodec.header.HeaderFields;
import com.sarcodec.layout.LayoutBuilder;
import com.sarcodec.layout.LayoutPlan;
import com.sarcodec.layout.LayoutPlanner;
import com.sarcodec.nitf.ComplexityLevel;
import com.sarcodec.nitf.GeoLocation;
import com.sarcodec.nitf.NitfFieldTables;
import com.sarcodec.xml.TranscoderRegistry;
import com.sarcodec.xml.XmlHelper;
import com.sarcodec.xml.XmlTrees;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Objects;

/**
 * Plans a SICD NITF: one file header, the SICD image segments, one XML_DATA_CONTENT data
 * extension carrying the SICD XML. Every length is derived from the plan before any byte is
 * written; the clock only feeds the FDT and DESSHDT timestamps, which never change a length.
 */
@Slf4j
public class SicdNitfPlanner implements LayoutPlanner<SicdNitfPlan> {
    public static final long MAX_FILE_LENGTH = 999_999_999_999L;
    private static final int MAX_BLOCK_PIXELS = 8192;

    private static final DateTimeFormatter NITF_DATE_TIME = DateTimeFormatter.ofPattern("yyyyMMddHHmmss");
    private static final DateTimeFormatter DES_DATE_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss'Z'");
    private static final String UNKNOWN_VERSION_DATE = "0000-00-00T00:00:00Z";

    private final TranscoderRegistry registry;
    private final Clock clock;

    public SicdNitfPlanner() {
        this(SicdTranscoders.create(), Clock.systemUTC());
    }

    public SicdNitfPlanner(TranscoderRegistry registry, Clock clock) {
        this.registry = Objects.requireNonNull(registry, "Registry cannot be null");
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
    }

    @Override
    public LayoutPlan plan(SicdNitfPlan model) throws SarCodecException {
        return layout(model).getPlan();
    }

    public SicdNitfLayout layout(SicdNitfPlan model) throws SarCodecException {
        var xml = new XmlHelper(model.getSicdXml(), registry);
        var pixelType = PixelType.fromName(required(xml, "ImageData", "PixelType", String.class));
        int numRows = dimension(required(xml, "ImageData", "NumRows", Long.class), "NumRows");
        int numCols = dimension(required(xml, "ImageData", "NumCols", Long.class), "NumCols");
        var corners = required(xml, "GeoData", "ImageCorners", double[][].class);
        var collectStart = required(xml, "Timeline", "CollectStart", OffsetDateTime.class);
        var namespace = xml.getRoot().getNamespaceURI();

        var sizing = ImageSegmentSizing.compute(numRows, numCols, pixelType, corners);
        var xmlBytes = XmlTrees.serialize(model.getSicdXml());
        var now = OffsetDateTime.now(clock).withOffsetSameInstant(ZoneOffset.UTC);

        var imageSubheaders = new ArrayList<HeaderFields>();
        var imageSubheaderBytes = new ArrayList<byte[]>();
        for (var segment : sizing) {
            var fields = imageSubheader(model, pixelType, numCols, collectStart, segment, sizing.size());
            imageSubheaders.add(fields);
            imageSubheaderBytes.add(HeaderFieldCodec.encode(NitfFieldTables.IMAGE_SUBHEADER, fields));
        }
        var desSubheader = desSubheader(model, namespace, corners, now);
        var desSubheaderBytes = HeaderFieldCodec.encode(NitfFieldTables.DES_SUBHEADER, desSubheader);

        var fileHeader = fileHeader(model, now, sizing.size());
        for (int i = 0; i < sizing.size(); i++) {
            fileHeader.put(lengthField("LISH", i), (long) imageSubheaderBytes.get(i).length)
                    .put(lengthField("LI", i), (long) sizing.get(i).getNumRows() * numCols * pixelType.getBytesPerPixel());
        }
        fileHeader.put("LDSH001", (long) desSubheaderBytes.length).put("LD001", (long) xmlBytes.length);
        int headerLength = HeaderFieldCodec.encodedLength(NitfFieldTables.FILE_HEADER, fileHeader);

        var builder = new LayoutBuilder("NITF", MAX_FILE_LENGTH, 1)
                .header(SicdNitfLayout.FILE_HEADER, headerLength)
                .pending("FHDR", 0, 4);
        for (int i = 0; i < sizing.size(); i++) {
            builder.header(SicdNitfLayout.imageSubheaderName(i), imageSubheaderBytes.get(i).length)
                    .data(SicdNitfLayout.imageSegmentName(i), pixelType.getDataType(), sizing.get(i).getNumRows(), numCols);
        }
        var plan = builder
                .header(SicdNitfLayout.DES_SUBHEADER, desSubheaderBytes.length)
                .metadata(SicdNitfLayout.SICD_XML, xmlBytes.length)
                .build();

        int maxSegmentRows = sizing.stream().mapToInt(ImageSegmentSizing.SegmentInfo::getNumRows).max().orElse(numRows);
        fileHeader.put("CLEVEL", (long) ComplexityLevel.compute(plan.getTotalLength(), maxSegmentRows, numCols))
                .put("FL", plan.getTotalLength())
                .put("HL", (long) headerLength);
        var fileHeaderBytes = HeaderFieldCodec.encode(NitfFieldTables.FILE_HEADER, fileHeader);
        if (fileHeaderBytes.length != headerLength) {
            throw new SarCodecException(ErrorType.LAYOUT_ERROR, "File header length changed from " + headerLength
                    + " to " + fileHeaderBytes.length + " bytes after setting FL/HL");
        }
        log.debug("SICD {} {}x{} planned as {} image segment(s), {} XML bytes", pixelType, numRows, numCols,
                sizing.size(), xmlBytes.length);
        return new SicdNitfLayout(model, plan, pixelType, numRows, numCols, sizing, fileHeader, imageSubheaders,
                desSubheader, fileHeaderBytes, imageSubheaderBytes, desSubheaderBytes, xmlBytes);
    }

    private HeaderFields fileHeader(SicdNitfPlan model, OffsetDateTime now, int numImages) {
        var fields = new HeaderFields()
                .put("CLEVEL", 3L)
                .put("STYPE", "BF01")
                .put("FDT", now.format(NITF_DATE_TIME))
                .put("FL", 0L)
                .put("HL", 0L)
                .put("NUMI", (long) numImages)
                .put("NUMS", 0L)
                .put("NUMX", 0L)
                .put("NUMT", 0L)
                .put("NUMDES", 1L)
                .put("NUMRES", 0L)
                .put("UDHDL", 0L)
                .put("XHDL", 0L);
        model.getHeaderFields().applyTo(fields);
        return fields;
    }

    private HeaderFields imageSubheader(SicdNitfPlan model, PixelType pixelType, int numCols, OffsetDateTime collectStart,
                                        ImageSegmentSizing.SegmentInfo segment, int segmentCount) {
        long bits = pixelType.getBitsPerBand();
        var fields = new HeaderFields()
                .put("IID1", segmentCount > 1 ? String.format("SICD%03d", segment.getIndex() + 1) : "SICD000")
                .put("IDATIM", collectStart.withOffsetSameInstant(ZoneOffset.UTC).format(NITF_DATE_TIME))
                .put("NROWS", (long) segment.getNumRows())
                .put("NCOLS", (long) numCols)
                .put("PVTYPE", pixelType.getPvtype())
                .put("IREP", "NODISPLY")
                .put("ICAT", "SAR")
                .put("ABPP", bits)
                .put("PJUST", "R")
                .put("ICORDS", "G")
                .put("IGEOLO", segment.getIgeolo())
                .put("IC", "NC")
                .put("NBANDS", 2L)
                .put("ISUBCAT1", pixelType.getFirstSubcategory())
                .put("ISUBCAT2", pixelType.getSecondSubcategory())
                .put("IMODE", "P")
                .put("NBPR", 1L)
                .put("NBPC", 1L)
                .put("NPPBH", numCols > MAX_BLOCK_PIXELS ? 0L : numCols)
                .put("NPPBV", segment.getNumRows() > MAX_BLOCK_PIXELS ? 0L : segment.getNumRows())
                .put("NBPP", bits)
                .put("IDLVL", (long) segment.getIdlvl())
                .put("IALVL", (long) segment.getIalvl())
                .put("ILOC", String.format("%05d%05d", segment.getIlocRow(), 0))
                .put("IMAG", "1.0");
        model.getImageSegmentFields().applyTo(fields);
        return fields;
    }

    private HeaderFields desSubheader(SicdNitfPlan model, String namespace, double[][] corners, OffsetDateTime now) {
        var version = SicdVersions.lookup(namespace);
        if (version.isEmpty()) {
            log.warn("Unknown SICD version: {}", namespace);
        }
        var ring = new double[corners.length + 1][];
        System.arraycopy(corners, 0, ring, 0, corners.length);
        ring[corners.length] = corners[0];
        var fields = new HeaderFields()
                .put("DESID", NitfFieldTables.XML_DATA_CONTENT)
                .put("DESVER", 1L)
                .put("DESSHL", (long) NitfFieldTables.XML_DATA_CONTENT_DESSHL)
                .put("DESCRC", 99999L)
                .put("DESSHFT", "XML")
                .put("DESSHDT", now.format(DES_DATE_TIME))
                .put("DESSHSI", SicdVersions.SPECIFICATION_IDENTIFIER)
                .put("DESSHSV", version.map(SicdVersions.VersionInfo::getVersion).orElse("unknown"))
                .put("DESSHSD", version.map(SicdVersions.VersionInfo::getDate).orElse(UNKNOWN_VERSION_DATE))
                .put("DESSHTN", namespace)
                .put("DESSHLPG", GeoLocation.formatLatLonPolygon(ring));
        model.getDesFields().applyTo(fields);
        return fields;
    }

    private <T> T required(XmlHelper xml, String group, String name, Class<T> type) throws SarCodecException {
        var value = xml.load("./{*}" + group + "/{*}" + name, type);
        if (value == null) {
            throw new SarCodecException(ErrorType.MALFORMED_XML, "SICD XML has no " + group + "/" + name);
        }
        return value;
    }

    private static int dimension(long value, String name) throws SarCodecException {
        if (value <= 0 || value > Integer.MAX_VALUE) {
            throw new SarCodecException(ErrorType.LAYOUT_ERROR, "SICD ImageData/" + name + " must be positive and fit "
                    + "an int, got " + value);
        }
        return (int) value;
    }

    private static String lengthField(String prefix, int index) {
        return String.format("%s%03d", prefix, index + 1);
    }
}
