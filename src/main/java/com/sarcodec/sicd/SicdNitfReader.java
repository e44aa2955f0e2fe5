package com.sarcodec.sicd;

import com.sarcodec.data.PayloadArray;
import com.sarcodec.error.ErrorType;
import com.sarcodec.error.SarCodecException;
import com.sarcodec.header.FieldTable;
import com.sarcodec.header.HeaderFieldCodec;
import com.sarcodec.header.HeaderFields;
import com.sarcodec.io.ByteSource;
import com.sarcodec.io.ContainerReader;
import com.sarcodec.io.FileByteSource;
import com.sarcodec.layout.LayoutPlan;
import com.sarcodec.layout.Segment;
import com.sarcodec.layout.SegmentKind;
import com.sarcodec.nitf.NitfFieldTables;
import com.sarcodec.xml.TranscoderRegistry;
import com.sarcodec.xml.XmlHelper;
import com.sarcodec.xml.XmlTrees;
import lombok.extern.slf4j.Slf4j;
import org.jdom2.Document;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Reads a SICD NITF. Opening decodes the file header, every image and DES subheader and the
 * SICD XML; pixels are read only by the {@code readImage*} methods, each reading exactly the
 * bytes it returns.
 *
 * <pre>{@code
 * try (var reader = SicdNitfReader.open(path)) {
 *     var xml = reader.getSicdXml();
 *     var pixels = reader.readImage();
 * }
 * }</pre>
 */
@Slf4j
public class SicdNitfReader extends ContainerReader {
    private static final int FILE_HEADER_PREFIX = NitfFieldTables.HL_OFFSET + NitfFieldTables.HL.getWidth();

    private final HeaderFields fileHeader;
    private final List<HeaderFields> imageSubheaders = new ArrayList<>();
    private final List<HeaderFields> desSubheaders = new ArrayList<>();
    private final List<Integer> sicdImages = new ArrayList<>();
    private final List<Integer> sicdImageSegments = new ArrayList<>();
    private final LayoutPlan layout;
    private final Document sicdXml;
    private final XmlHelper xmlHelper;
    private final PixelType pixelType;
    private final int numRows;
    private final int numCols;

    /**
     * Opens {@code path}; the file is released again if it is not a readable SICD.
     */
    public static SicdNitfReader open(Path path) throws IOException, SarCodecException {
        var source = new FileByteSource(path);
        try {
            return new SicdNitfReader(source);
        } catch (IOException | SarCodecException | RuntimeException e) {
            source.close();
            throw e;
        }
    }

    public SicdNitfReader(ByteSource source) throws IOException, SarCodecException {
        this(source, SicdTranscoders.create());
    }

    public SicdNitfReader(ByteSource source, TranscoderRegistry registry) throws IOException, SarCodecException {
        super(source);
        if (source.size() < FILE_HEADER_PREFIX) {
            throw new SarCodecException(ErrorType.MALFORMED_HEADER, source.getSourceIdentifier() + " has "
                    + source.size() + " bytes, too short for a NITF file header");
        }
        var prefix = bytes(readBytes(0, FILE_HEADER_PREFIX));
        long headerLength = (Long) HeaderFieldCodec.decodeField(NitfFieldTables.HL, prefix, NitfFieldTables.HL_OFFSET, 0);
        if (headerLength < FILE_HEADER_PREFIX) {
            throw new SarCodecException(ErrorType.MALFORMED_HEADER, "Field HL at offset " + NitfFieldTables.HL_OFFSET
                    + ": header length " + headerLength + " is shorter than the fixed fields");
        }
        this.fileHeader = decode(NitfFieldTables.FILE_HEADER, 0, headerLength);

        var segments = new ArrayList<Segment>();
        segments.add(new Segment(0, SegmentKind.HEADER, SicdNitfLayout.FILE_HEADER, 0, headerLength, null, null));
        long offset = headerLength;
        int numImages = fileHeader.getInt("NUMI");
        var imageData = new ArrayList<Segment>();
        for (int i = 0; i < numImages; i++) {
            long subheaderLength = fileHeader.getLong(lengthField("LISH", i));
            imageSubheaders.add(decode(NitfFieldTables.IMAGE_SUBHEADER, offset, subheaderLength));
            segments.add(new Segment(segments.size(), SegmentKind.HEADER, SicdNitfLayout.imageSubheaderName(i),
                    offset, subheaderLength, null, null));
            offset += subheaderLength;
            long dataLength = fileHeader.getLong(lengthField("LI", i));
            var placeholder = new Segment(segments.size(), SegmentKind.METADATA, SicdNitfLayout.imageSegmentName(i),
                    offset, dataLength, null, null);
            segments.add(placeholder);
            imageData.add(placeholder);
            offset += dataLength;
        }
        offset = skipSegments(segments, offset, "NUMS", "LSSH", "LS", "graphic");
        offset = skipSegments(segments, offset, "NUMT", "LTSH", "LT", "text");

        int numDes = fileHeader.getInt("NUMDES");
        Segment xmlSegment = null;
        for (int i = 0; i < numDes; i++) {
            long subheaderLength = fileHeader.getLong(lengthField("LDSH", i));
            desSubheaders.add(decode(NitfFieldTables.DES_SUBHEADER, offset, subheaderLength));
            segments.add(new Segment(segments.size(), SegmentKind.HEADER, String.format("DES subheader %03d", i + 1),
                    offset, subheaderLength, null, null));
            offset += subheaderLength;
            long dataLength = fileHeader.getLong(lengthField("LD", i));
            var segment = new Segment(segments.size(), SegmentKind.METADATA,
                    i == 0 ? SicdNitfLayout.SICD_XML : String.format("DES %03d", i + 1), offset, dataLength, null, null);
            segments.add(segment);
            if (i == 0) xmlSegment = segment;
            offset += dataLength;
        }
        offset = skipSegments(segments, offset, "NUMRES", "LRESH", "LRE", "reserved extension");

        long fileLength = fileHeader.getLong("FL");
        if (offset != fileLength) {
            throw new SarCodecException(ErrorType.MALFORMED_HEADER, "Field FL at offset 342: file length " + fileLength
                    + " does not match the " + offset + " bytes of the segments in the header");
        }
        if (source.size() < fileLength) {
            throw new SarCodecException(ErrorType.MALFORMED_HEADER, source.getSourceIdentifier() + " is truncated: FL is "
                    + fileLength + " but only " + source.size() + " bytes are present");
        }

        if (xmlSegment == null || !desSubheaders.get(0).getString("DESSHTN").startsWith(SicdVersions.NAMESPACE_PREFIX)) {
            throw new SarCodecException(ErrorType.UNSUPPORTED_FORMAT, source.getSourceIdentifier()
                    + ": first data extension is not SICD XML");
        }
        if (xmlSegment.getLength() > Integer.MAX_VALUE) {
            throw new SarCodecException(ErrorType.MALFORMED_HEADER, "SICD XML segment of " + xmlSegment.getLength()
                    + " bytes is too large");
        }
        this.sicdXml = XmlTrees.parse(bytes(readBytes(xmlSegment.getOffset(), (int) xmlSegment.getLength())));
        this.xmlHelper = new XmlHelper(sicdXml, registry);
        this.pixelType = PixelType.fromName(required("ImageData", "PixelType", String.class));
        this.numRows = Math.toIntExact(required("ImageData", "NumRows", Long.class));
        this.numCols = Math.toIntExact(required("ImageData", "NumCols", Long.class));

        for (int i = 0; i < numImages; i++) {
            var iid1 = imageSubheaders.get(i).getString("IID1");
            if (iid1.startsWith("SICD")) {
                sicdImages.add(i);
            } else {
                log.warn("Ignoring non-SICD image segment {} (IID1='{}') in {}", i + 1, iid1, source.getSourceIdentifier());
            }
        }
        sicdImages.sort(Comparator.comparing(i -> imageSubheaders.get(i).getString("IID1")));
        if (sicdImages.isEmpty()) {
            throw new SarCodecException(ErrorType.UNSUPPORTED_FORMAT, source.getSourceIdentifier() + " has no SICD image segments");
        }
        long rowsSeen = 0;
        for (int i : sicdImages) {
            var subheader = imageSubheaders.get(i);
            var placeholder = imageData.get(i);
            if (!"NC".equals(subheader.getString("IC"))) {
                throw new SarCodecException(ErrorType.UNSUPPORTED_FORMAT, "Image segment " + (i + 1)
                        + " has IC=" + subheader.getString("IC") + "; only uncompressed (NC) SICD images are supported");
            }
            long rows = subheader.getLong("NROWS");
            long cols = subheader.getLong("NCOLS");
            if (cols != numCols) {
                throw new SarCodecException(ErrorType.MALFORMED_HEADER, "Image segment " + (i + 1) + " has NCOLS="
                        + cols + " but SICD NumCols is " + numCols);
            }
            if (rows * cols * pixelType.getBytesPerPixel() != placeholder.getLength()) {
                throw new SarCodecException(ErrorType.MALFORMED_HEADER, "Field " + lengthField("LI", i) + ": length "
                        + placeholder.getLength() + " does not match " + rows + " x " + cols + " " + pixelType + " pixels");
            }
            segments.set(placeholder.getIndex(), new Segment(placeholder.getIndex(), SegmentKind.DATA, placeholder.getName(),
                    placeholder.getOffset(), placeholder.getLength(), pixelType.getDataType(), new int[]{(int) rows, numCols}));
            sicdImageSegments.add(placeholder.getIndex());
            rowsSeen += rows;
        }
        if (rowsSeen != numRows) {
            throw new SarCodecException(ErrorType.MALFORMED_HEADER, "SICD image segments hold " + rowsSeen
                    + " rows but SICD NumRows is " + numRows);
        }
        this.layout = new LayoutPlan("NITF", Collections.unmodifiableList(segments), fileLength, List.of());
        log.info("Opened SICD {} ({} {}x{}, {} image segment(s))", source.getSourceIdentifier(), pixelType,
                numRows, numCols, sicdImageSegments.size());
    }

    @Override
    public LayoutPlan getLayout() {
        return layout;
    }

    public Document getSicdXml() {
        return sicdXml;
    }

    /**
     * Typed access to the SICD XML through the registry the reader was opened with.
     */
    public XmlHelper getXmlHelper() {
        return xmlHelper;
    }

    public HeaderFields getFileHeader() {
        return fileHeader.copy();
    }

    public List<HeaderFields> getImageSubheaders() {
        var copies = new ArrayList<HeaderFields>();
        imageSubheaders.forEach(h -> copies.add(h.copy()));
        return copies;
    }

    public HeaderFields getDesSubheader() {
        return desSubheaders.get(0).copy();
    }

    public PixelType getPixelType() {
        return pixelType;
    }

    public int getNumRows() {
        return numRows;
    }

    public int getNumCols() {
        return numCols;
    }

    public int getImageSegmentCount() {
        return sicdImageSegments.size();
    }

    public SicdNitfHeaderFields getHeaderFields() {
        return SicdNitfHeaderFields.from(fileHeader);
    }

    /**
     * Fields of the first SICD image segment; SICD writers give every segment the same ones.
     */
    public SicdNitfImageSegmentFields getImageSegmentFields() {
        return SicdNitfImageSegmentFields.from(imageSubheaders.get(sicdImages.get(0)));
    }

    public SicdNitfDesFields getDesFields() {
        return SicdNitfDesFields.from(desSubheaders.get(0));
    }

    /**
     * A plan that writes a SICD with the same XML and producer fields as this one.
     */
    public SicdNitfPlan getNitfPlan() {
        return SicdNitfPlan.builder()
                .sicdXml(sicdXml.clone())
                .headerFields(getHeaderFields())
                .imageSegmentFields(getImageSegmentFields())
                .desFields(getDesFields())
                .build();
    }

    /**
     * Reads the whole image, assembling the image segments in IID1 order.
     */
    public PayloadArray readImage() throws IOException, SarCodecException {
        return readImageRows(0, numRows);
    }

    /**
     * Reads the pixels of one SICD image segment.
     */
    public PayloadArray readImageSegment(int index) throws IOException, SarCodecException {
        if (index < 0 || index >= sicdImageSegments.size()) {
            throw new SarCodecException(ErrorType.OUT_OF_RANGE, "No SICD image segment " + index + "; file has "
                    + sicdImageSegments.size());
        }
        return readSegment(sicdImageSegments.get(index));
    }

    /**
     * Reads {@code count} full image rows starting at {@code startRow}, crossing image
     * segment boundaries as needed.
     */
    public PayloadArray readImageRows(int startRow, int count) throws IOException, SarCodecException {
        if (startRow < 0 || count < 0 || (long) startRow + count > numRows) {
            throw new SarCodecException(ErrorType.OUT_OF_RANGE, "Rows [" + startRow + ", " + ((long) startRow + count)
                    + ") outside SICD image with " + numRows + " rows");
        }
        long rowBytes = (long) numCols * pixelType.getBytesPerPixel();
        if (rowBytes * count > Integer.MAX_VALUE) {
            throw new SarCodecException(ErrorType.OUT_OF_RANGE, "Cannot read " + rowBytes * count
                    + " bytes of image at once; read fewer rows");
        }
        var out = ByteBuffer.allocate((int) (rowBytes * count));
        int endRow = startRow + count;
        int firstRow = 0;
        for (int index : sicdImageSegments) {
            var segment = layout.getSegment(index);
            int segmentRows = segment.getShape()[0];
            int from = Math.max(startRow, firstRow);
            int to = Math.min(endRow, firstRow + segmentRows);
            if (from < to) {
                out.put(readRows(segment, from - firstRow, to - from).asByteBuffer());
            }
            firstRow += segmentRows;
        }
        return PayloadArray.wrap(pixelType.getDataType(), out.flip(), count, numCols);
    }

    private long skipSegments(List<Segment> segments, long offset, String countField, String subheaderPrefix,
                              String dataPrefix, String label) {
        int count = fileHeader.getInt(countField);
        for (int i = 0; i < count; i++) {
            long subheaderLength = fileHeader.getLong(lengthField(subheaderPrefix, i));
            segments.add(new Segment(segments.size(), SegmentKind.HEADER, String.format("%s subheader %03d", label, i + 1),
                    offset, subheaderLength, null, null));
            offset += subheaderLength;
            long dataLength = fileHeader.getLong(lengthField(dataPrefix, i));
            segments.add(new Segment(segments.size(), SegmentKind.METADATA, String.format("%s %03d", label, i + 1),
                    offset, dataLength, null, null));
            offset += dataLength;
        }
        if (count > 0) {
            log.warn("Skipping {} {} segment(s) in {}", count, label, getSourceIdentifier());
        }
        return offset;
    }

    private HeaderFields decode(FieldTable table, long offset, long length) throws IOException, SarCodecException {
        if (length > Integer.MAX_VALUE) {
            throw new SarCodecException(ErrorType.MALFORMED_HEADER, table.getName() + " at offset " + offset
                    + " claims " + length + " bytes");
        }
        return HeaderFieldCodec.decode(table, bytes(readBytes(offset, (int) length)), offset);
    }

    private <T> T required(String group, String name, Class<T> type) throws SarCodecException {
        var value = xmlHelper.load("./{*}" + group + "/{*}" + name, type);
        if (value == null) {
            throw new SarCodecException(ErrorType.MALFORMED_XML, "SICD XML has no " + group + "/" + name);
        }
        return value;
    }

    private static String lengthField(String prefix, int index) {
        return String.format("%s%03d", prefix, index + 1);
    }

    private static byte[] bytes(ByteBuffer buffer) {
        var bytes = new byte[buffer.remaining()];
        buffer.get(bytes);
        return bytes;
    }
}
