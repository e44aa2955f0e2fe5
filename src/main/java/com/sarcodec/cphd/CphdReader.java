package com.sarcodec.cphd;

import com.sarcodec.data.DataType;
import com.sarcodec.data.PayloadArray;
import com.sarcodec.error.ErrorType;
import com.sarcodec.error.SarCodecException;
import com.sarcodec.io.ByteSource;
import com.sarcodec.io.ContainerReader;
import com.sarcodec.io.FileByteSource;
import com.sarcodec.layout.LayoutPlan;
import com.sarcodec.layout.Segment;
import com.sarcodec.layout.SegmentKind;
import com.sarcodec.xml.TranscoderRegistry;
import com.sarcodec.xml.XmlHelper;
import com.sarcodec.xml.XmlTrees;
import lombok.Value;
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
 * Reads a CPHD. Opening parses the header and the XML; arrays are read on request, each
 * read covering exactly the bytes of the requested array.
 *
 * <pre>{@code
 * try (var reader = CphdReader.open(path)) {
 *     var channel = reader.readChannel("1");
 * }
 * }</pre>
 */
@Slf4j
public class CphdReader extends ContainerReader {
    private static final int HEADER_CHUNK = 4096;
    private static final int MAX_HEADER_LENGTH = 1 << 20;

    private final CphdHeader header;
    private final Document cphdXml;
    private final XmlHelper xmlHelper;
    private final CphdStructure structure;
    private final LayoutPlan layout;

    /**
     * Signal and per-vector parameters of one channel.
     */
    @Value
    public static class ChannelData {
        PayloadArray signal;
        PayloadArray pvps;
    }

    public static CphdReader open(Path path) throws IOException, SarCodecException {
        var source = new FileByteSource(path);
        try {
            return new CphdReader(source);
        } catch (IOException | SarCodecException | RuntimeException e) {
            source.close();
            throw e;
        }
    }

    public CphdReader(ByteSource source) throws IOException, SarCodecException {
        this(source, CphdTranscoders.create());
    }

    public CphdReader(ByteSource source, TranscoderRegistry registry) throws IOException, SarCodecException {
        super(source);
        long size = source.size();
        this.header = readHeader(size);
        if (CphdVersions.all().values().stream().noneMatch(v -> v.getVersion().equals(header.getVersion()))) {
            log.warn("Unknown CPHD version {} in {}", header.getVersion(), source.getSourceIdentifier());
        }

        long xmlOffset = header.getLong(CphdHeader.XML_BLOCK_BYTE_OFFSET);
        long xmlSize = header.getLong(CphdHeader.XML_BLOCK_SIZE);
        if (xmlSize > Integer.MAX_VALUE) {
            throw new SarCodecException(ErrorType.MALFORMED_HEADER, "CPHD XML block of " + xmlSize + " bytes is too large");
        }
        this.cphdXml = XmlTrees.parse(bytes(readBytes(xmlOffset, (int) xmlSize)));
        this.xmlHelper = new XmlHelper(cphdXml, registry);
        this.structure = CphdStructure.parse(xmlHelper);
        this.layout = reconstructLayout(size, xmlOffset, xmlSize);
        log.info("Opened CPHD {} (version {}, {} channel(s), {} support array(s))", source.getSourceIdentifier(),
                header.getVersion(), structure.getChannels().size(), structure.getSupportArrays().size());
    }

    @Override
    public LayoutPlan getLayout() {
        return layout;
    }

    public CphdHeader getHeader() {
        return header;
    }

    public Document getCphdXml() {
        return cphdXml;
    }

    public XmlHelper getXmlHelper() {
        return xmlHelper;
    }

    public CphdStructure getStructure() {
        return structure;
    }

    /**
     * Producer-chosen header values.
     *
     * @throws SarCodecException MALFORMED_HEADER when CLASSIFICATION or RELEASE_INFO is missing
     */
    public CphdFileHeaderFields getFileHeaderFields() throws SarCodecException {
        return CphdFileHeaderFields.builder()
                .classification(header.getRequired(CphdHeader.CLASSIFICATION))
                .releaseInfo(header.getRequired(CphdHeader.RELEASE_INFO))
                .additionalKvps(header.additionalKvps())
                .build();
    }

    /**
     * A plan that writes a CPHD with the same XML and header values as this one.
     */
    public CphdPlan getPlan() throws SarCodecException {
        return CphdPlan.builder()
                .cphdXml(cphdXml.clone())
                .fileHeader(getFileHeaderFields())
                .build();
    }

    public PayloadArray readSignal(String channel) throws IOException, SarCodecException {
        return readSegment(segment(CphdLayout.signalSegmentName(requireChannel(channel))).getIndex());
    }

    /**
     * Reads {@code numVectors} signal vectors of a channel starting at {@code startVector}.
     */
    public PayloadArray readSignal(String channel, int startVector, int numVectors) throws IOException, SarCodecException {
        return readRows(segment(CphdLayout.signalSegmentName(requireChannel(channel))), startVector, numVectors);
    }

    public PayloadArray readPvps(String channel) throws IOException, SarCodecException {
        return readSegment(segment(CphdLayout.pvpSegmentName(requireChannel(channel))).getIndex());
    }

    public ChannelData readChannel(String channel) throws IOException, SarCodecException {
        return new ChannelData(readSignal(channel), readPvps(channel));
    }

    public PayloadArray readSupportArray(String identifier) throws IOException, SarCodecException {
        if (structure.supportArray(identifier).isEmpty()) {
            throw new SarCodecException(ErrorType.OUT_OF_RANGE, "CPHD XML declares no support array " + identifier);
        }
        return readSegment(segment(CphdLayout.supportSegmentName(identifier)).getIndex());
    }

    private CphdHeader readHeader(long size) throws IOException, SarCodecException {
        int length = (int) Math.min(size, HEADER_CHUNK);
        while (true) {
            var bytes = bytes(readBytes(0, length));
            int end = CphdHeader.findEnd(bytes, bytes.length);
            if (end > 0) {
                return CphdHeader.decode(bytes, end);
            }
            if (length == size || length >= MAX_HEADER_LENGTH) {
                throw new SarCodecException(ErrorType.MALFORMED_HEADER, "No CPHD header terminator in the first "
                        + length + " bytes of " + getSourceIdentifier());
            }
            length = (int) Math.min(size, Math.min((long) length * 2, MAX_HEADER_LENGTH));
        }
    }

    private LayoutPlan reconstructLayout(long size, long xmlOffset, long xmlSize) throws SarCodecException {
        var arrays = new ArrayList<Segment>();
        if (!structure.getSupportArrays().isEmpty()) {
            long blockOffset = header.getLong(CphdHeader.SUPPORT_BLOCK_BYTE_OFFSET);
            long blockSize = header.getLong(CphdHeader.SUPPORT_BLOCK_SIZE);
            for (var array : structure.getSupportArrays()) {
                arrays.add(inBlock("support", blockOffset, blockSize, CphdLayout.supportSegmentName(array.getIdentifier()),
                        array.getArrayByteOffset(), array.getElementType(), array.getNumRows(), array.getNumCols()));
            }
        }
        long pvpOffset = header.getLong(CphdHeader.PVP_BLOCK_BYTE_OFFSET);
        long pvpSize = header.getLong(CphdHeader.PVP_BLOCK_SIZE);
        long signalOffset = header.getLong(CphdHeader.SIGNAL_BLOCK_BYTE_OFFSET);
        long signalSize = header.getLong(CphdHeader.SIGNAL_BLOCK_SIZE);
        for (var channel : structure.getChannels()) {
            arrays.add(inBlock("PVP", pvpOffset, pvpSize, CphdLayout.pvpSegmentName(channel.getIdentifier()),
                    channel.getPvpArrayByteOffset(), structure.getPvpType(), channel.getNumVectors()));
            arrays.add(inBlock("signal", signalOffset, signalSize, CphdLayout.signalSegmentName(channel.getIdentifier()),
                    channel.getSignalArrayByteOffset(), structure.getSignalType(), channel.getNumVectors(),
                    channel.getNumSamples()));
        }
        arrays.add(new Segment(0, SegmentKind.METADATA, CphdLayout.CPHD_XML, xmlOffset, xmlSize, null, null));
        arrays.add(new Segment(0, SegmentKind.HEADER, CphdLayout.XML_TERMINATOR, xmlOffset + xmlSize,
                CphdHeader.SECTION_TERMINATOR.length, null, null));
        arrays.sort(Comparator.comparingLong(Segment::getOffset));

        var segments = new ArrayList<Segment>();
        segments.add(new Segment(0, SegmentKind.HEADER, CphdLayout.FILE_HEADER, 0, xmlOffset, null, null));
        long cursor = xmlOffset;
        int gaps = 0;
        for (var array : arrays) {
            if (array.getOffset() < cursor) {
                throw new SarCodecException(ErrorType.MALFORMED_HEADER, "CPHD segment " + array.getName() + " at offset "
                        + array.getOffset() + " overlaps the previous segment ending at " + cursor);
            }
            if (array.getOffset() > cursor) {
                segments.add(new Segment(segments.size(), SegmentKind.PADDING, "gap " + ++gaps, cursor,
                        array.getOffset() - cursor, null, null));
            }
            segments.add(new Segment(segments.size(), array.getKind(), array.getName(), array.getOffset(),
                    array.getLength(), array.getDataType(), array.getShape()));
            cursor = array.getEnd();
        }
        if (cursor > size) {
            throw new SarCodecException(ErrorType.MALFORMED_HEADER, getSourceIdentifier() + " is truncated: arrays end at "
                    + cursor + " but the file has " + size + " bytes");
        }
        if (cursor < size) {
            segments.add(new Segment(segments.size(), SegmentKind.PADDING, "trailing bytes", cursor, size - cursor, null, null));
        }
        return new LayoutPlan("CPHD", Collections.unmodifiableList(segments), size, List.of());
    }

    private static Segment inBlock(String block, long blockOffset, long blockSize, String name, long offset,
                                   DataType dataType, int... shape) throws SarCodecException {
        long length = dataType.getItemSize();
        for (int dim : shape) {
            length *= dim;
        }
        if (offset + length > blockSize) {
            throw new SarCodecException(ErrorType.MALFORMED_HEADER, "CPHD " + name + " ends at byte " + (offset + length)
                    + " of the " + block + " block, beyond its size " + blockSize);
        }
        return new Segment(0, SegmentKind.DATA, name, blockOffset + offset, length, dataType, shape);
    }

    private String requireChannel(String channel) throws SarCodecException {
        if (structure.channel(channel).isEmpty()) {
            throw new SarCodecException(ErrorType.OUT_OF_RANGE, "CPHD XML declares no channel " + channel);
        }
        return channel;
    }

    private Segment segment(String name) {
        return layout.find(name).orElseThrow(() -> new IllegalStateException("Layout has no segment " + name));
    }

    private static byte[] bytes(ByteBuffer buffer) {
        var bytes = new byte[buffer.remaining()];
        buffer.get(bytes);
        return bytes;
    }
}
