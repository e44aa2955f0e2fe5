package com.sarcodec.cphd;

import com.sarcodec.data.PayloadArray;
import com.sarcodec.error.ErrorType;
import com.sarcodec.error.SarCodecException;
import com.sarcodec.io.ContainerWriter;
import com.sarcodec.layout.Segment;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Arrays;

/**
 * Writes a CPHD. The header and XML are written at construction; every signal, PVP and
 * support array the XML declares must then be written before {@link #close()}.
 *
 * <pre>{@code
 * try (var writer = new CphdWriter(path, plan)) {
 *     writer.writeSupportArray("AntPattern", gains);
 *     writer.writePvp("1", pvps);
 *     writer.writeSignal("1", signal);
 * }
 * }</pre>
 */
@Slf4j
public class CphdWriter extends ContainerWriter {
    private final CphdLayout layout;

    public CphdWriter(Path target, CphdPlan plan) throws IOException, SarCodecException {
        this(target, plan, new CphdPlanner());
    }

    public CphdWriter(Path target, CphdPlan plan, CphdPlanner planner) throws IOException, SarCodecException {
        this(target, planner.layout(plan.snapshot()));
    }

    private CphdWriter(Path target, CphdLayout layout) throws IOException, SarCodecException {
        super(target, layout.getPlan());
        this.layout = layout;
        try {
            writeAt(0, layout.getHeaderBytes());
            writeAt(segment(CphdLayout.CPHD_XML).getOffset(), layout.getXmlBytes());
            writeAt(segment(CphdLayout.XML_TERMINATOR).getOffset(), CphdHeader.SECTION_TERMINATOR);
        } catch (IOException | SarCodecException | RuntimeException e) {
            abort();
            throw e;
        }
        log.debug("Wrote CPHD header and {} bytes of XML", layout.getXmlBytes().length);
    }

    public CphdPlan getPlan() {
        return layout.getModel();
    }

    public CphdStructure getStructure() {
        return layout.getStructure();
    }

    public CphdHeader getHeader() {
        return layout.getHeader();
    }

    /**
     * Writes the complete signal array of a channel.
     */
    public void writeSignal(String channel, PayloadArray signal) throws IOException, SarCodecException {
        var segment = segment(CphdLayout.signalSegmentName(requireChannel(channel)));
        requireFullShape(segment, signal);
        writePayload(segment.getIndex(), signal, 0, 0);
    }

    /**
     * Writes a block of a channel's signal array whose first sample is at
     * ({@code startVector}, {@code startSample}).
     */
    public void writeSignal(String channel, PayloadArray signal, int startVector, int startSample)
            throws IOException, SarCodecException {
        var segment = segment(CphdLayout.signalSegmentName(requireChannel(channel)));
        writePayload(segment.getIndex(), signal, startVector, startSample);
    }

    /**
     * Writes all per-vector parameters of a channel. The array's element type must be
     * {@link CphdStructure#getPvpType()}.
     */
    public void writePvp(String channel, PayloadArray pvps) throws IOException, SarCodecException {
        var segment = segment(CphdLayout.pvpSegmentName(requireChannel(channel)));
        requireFullShape(segment, pvps);
        writePayload(segment.getIndex(), pvps, 0, 0);
    }

    public void writePvp(String channel, PayloadArray pvps, int startVector) throws IOException, SarCodecException {
        var segment = segment(CphdLayout.pvpSegmentName(requireChannel(channel)));
        writePayload(segment.getIndex(), pvps, startVector, 0);
    }

    public void writeSupportArray(String identifier, PayloadArray array) throws IOException, SarCodecException {
        if (layout.getStructure().supportArray(identifier).isEmpty()) {
            throw new SarCodecException(ErrorType.OUT_OF_RANGE, "CPHD XML declares no support array " + identifier);
        }
        var segment = segment(CphdLayout.supportSegmentName(identifier));
        requireFullShape(segment, array);
        writePayload(segment.getIndex(), array, 0, 0);
    }

    private String requireChannel(String channel) throws SarCodecException {
        if (layout.getStructure().channel(channel).isEmpty()) {
            throw new SarCodecException(ErrorType.OUT_OF_RANGE, "CPHD XML declares no channel " + channel);
        }
        return channel;
    }

    private static void requireFullShape(Segment segment, PayloadArray array) throws SarCodecException {
        if (!Arrays.equals(segment.getShape(), array.getShape())) {
            throw new SarCodecException(ErrorType.PAYLOAD_MISMATCH, "Array shape " + Arrays.toString(array.getShape())
                    + " does not match " + segment.getName() + " shape " + Arrays.toString(segment.getShape()));
        }
    }

    private Segment segment(String name) {
        return getLayout().find(name).orElseThrow(() -> new IllegalStateException("Layout has no segment " + name));
    }
}
