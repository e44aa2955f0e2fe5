package com.sarcodec.cphd;

import com.sarcodec.data.DataType;
import com.sarcodec.error.ErrorType;
import com.sarcodec.error.SarCodecException;
import com.sarcodec.layout.LayoutBuilder;
import com.sarcodec.layout.LayoutPlan;
import com.sarcodec.layout.LayoutPlanner;
import com.sarcodec.xml.TranscoderRegistry;
import com.sarcodec.xml.XmlHelper;
import com.sarcodec.xml.XmlTrees;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;

/**
 * Plans a CPHD: the header reserved at its 64-byte aligned placeholder size, the XML and its
 * terminator, then the support, PVP and signal blocks. Arrays sit at the byte offsets the XML
 * declares within their block; gaps between them become padding.
 */
@Slf4j
public class CphdPlanner implements LayoutPlanner<CphdPlan> {
    private final TranscoderRegistry registry;

    public CphdPlanner() {
        this(CphdTranscoders.create());
    }

    public CphdPlanner(TranscoderRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "Registry cannot be null");
    }

    @Override
    public LayoutPlan plan(CphdPlan model) throws SarCodecException {
        return layout(model).getPlan();
    }

    public CphdLayout layout(CphdPlan model) throws SarCodecException {
        var xml = new XmlHelper(model.getCphdXml(), registry);
        var structure = CphdStructure.parse(xml);
        var namespace = xml.getRoot().getNamespaceURI();
        var version = CphdVersions.lookup(namespace)
                .orElseThrow(() -> new SarCodecException(ErrorType.LAYOUT_ERROR, "Unknown CPHD namespace: '" + namespace + "'"))
                .getVersion();
        var xmlBytes = XmlTrees.serialize(model.getCphdXml());

        var support = new ArrayList<BlockEntry>();
        for (var array : structure.getSupportArrays()) {
            support.add(new BlockEntry(CphdLayout.supportSegmentName(array.getIdentifier()), array.getArrayByteOffset(),
                    array.getElementType(), new int[]{array.getNumRows(), array.getNumCols()}));
        }
        var pvp = new ArrayList<BlockEntry>();
        var signal = new ArrayList<BlockEntry>();
        for (var channel : structure.getChannels()) {
            pvp.add(new BlockEntry(CphdLayout.pvpSegmentName(channel.getIdentifier()), channel.getPvpArrayByteOffset(),
                    structure.getPvpType(), new int[]{channel.getNumVectors()}));
            signal.add(new BlockEntry(CphdLayout.signalSegmentName(channel.getIdentifier()),
                    channel.getSignalArrayByteOffset(), structure.getSignalType(),
                    new int[]{channel.getNumVectors(), channel.getNumSamples()}));
        }
        long supportSize = blockSize("support", support);
        long pvpSize = blockSize("PVP", pvp);
        long signalSize = blockSize("signal", signal);

        var placeholder = kvps(model, xmlBytes.length, CphdHeader.OFFSET_PLACEHOLDER, pvpSize,
                CphdHeader.OFFSET_PLACEHOLDER, signalSize, CphdHeader.OFFSET_PLACEHOLDER,
                support.isEmpty() ? -1 : supportSize, CphdHeader.OFFSET_PLACEHOLDER);
        long reserved = new CphdHeader(version, placeholder).reservedLength();
        long xmlOffset = reserved;
        long supportOffset = xmlOffset + xmlBytes.length + CphdHeader.SECTION_TERMINATOR.length;
        long pvpOffset = supportOffset + (support.isEmpty() ? 0 : supportSize);
        long signalOffset = pvpOffset + pvpSize;
        var header = new CphdHeader(version, kvps(model, xmlBytes.length, Long.toString(xmlOffset), pvpSize,
                Long.toString(pvpOffset), signalSize, Long.toString(signalOffset),
                support.isEmpty() ? -1 : supportSize, Long.toString(supportOffset)));
        var headerBytes = header.encode();
        if (headerBytes.length > reserved) {
            throw new SarCodecException(ErrorType.LAYOUT_ERROR, "CPHD header of " + headerBytes.length
                    + " bytes exceeds its reserved " + reserved + " bytes");
        }

        var builder = new LayoutBuilder("CPHD", Long.MAX_VALUE, 1)
                .header(CphdLayout.FILE_HEADER, reserved)
                .metadata(CphdLayout.CPHD_XML, xmlBytes.length)
                .header(CphdLayout.XML_TERMINATOR, CphdHeader.SECTION_TERMINATOR.length);
        appendBlock(builder, "support", support);
        appendBlock(builder, "PVP", pvp);
        appendBlock(builder, "signal", signal);
        var plan = builder.build();
        log.debug("CPHD {} planned: {} channel(s), {} support array(s), {} bytes", version,
                structure.getChannels().size(), structure.getSupportArrays().size(), plan.getTotalLength());
        return new CphdLayout(model, structure, plan, header, headerBytes, xmlBytes);
    }

    private static LinkedHashMap<String, String> kvps(CphdPlan model, long xmlSize, String xmlOffset, long pvpSize,
                                                      String pvpOffset, long signalSize, String signalOffset,
                                                      long supportSize, String supportOffset) {
        var kvps = new LinkedHashMap<String, String>();
        kvps.put(CphdHeader.XML_BLOCK_SIZE, Long.toString(xmlSize));
        kvps.put(CphdHeader.XML_BLOCK_BYTE_OFFSET, xmlOffset);
        kvps.put(CphdHeader.PVP_BLOCK_SIZE, Long.toString(pvpSize));
        kvps.put(CphdHeader.PVP_BLOCK_BYTE_OFFSET, pvpOffset);
        kvps.put(CphdHeader.SIGNAL_BLOCK_SIZE, Long.toString(signalSize));
        kvps.put(CphdHeader.SIGNAL_BLOCK_BYTE_OFFSET, signalOffset);
        kvps.put(CphdHeader.CLASSIFICATION, model.getFileHeader().getClassification());
        kvps.put(CphdHeader.RELEASE_INFO, model.getFileHeader().getReleaseInfo());
        if (supportSize >= 0) {
            kvps.put(CphdHeader.SUPPORT_BLOCK_SIZE, Long.toString(supportSize));
            kvps.put(CphdHeader.SUPPORT_BLOCK_BYTE_OFFSET, supportOffset);
        }
        kvps.putAll(model.getFileHeader().getAdditionalKvps());
        return kvps;
    }

    private static long blockSize(String block, List<BlockEntry> entries) throws SarCodecException {
        long end = 0;
        for (var entry : sorted(entries)) {
            if (entry.getOffset() < end) {
                throw new SarCodecException(ErrorType.LAYOUT_ERROR, "CPHD " + block + " array " + entry.getName()
                        + " at block offset " + entry.getOffset() + " overlaps the previous array ending at " + end);
            }
            end = Math.addExact(entry.getOffset(), entry.length());
        }
        return end;
    }

    private static void appendBlock(LayoutBuilder builder, String block, List<BlockEntry> entries) throws SarCodecException {
        long start = builder.currentOffset();
        int gaps = 0;
        for (var entry : sorted(entries)) {
            long gap = start + entry.getOffset() - builder.currentOffset();
            if (gap > 0) {
                builder.padding(block + " block gap " + ++gaps, gap);
            }
            builder.data(entry.getName(), entry.getDataType(), entry.getShape());
        }
    }

    private static List<BlockEntry> sorted(List<BlockEntry> entries) {
        var copy = new ArrayList<>(entries);
        copy.sort(Comparator.comparingLong(BlockEntry::getOffset));
        return copy;
    }

    @Value
    private static class BlockEntry {
        String name;
        long offset;
        DataType dataType;
        int[] shape;

        long length() {
            long length = dataType.getItemSize();
            for (int dim : shape) {
                length *= dim;
            }
            return length;
        }
    }
}
