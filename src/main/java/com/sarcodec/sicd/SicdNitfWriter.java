package com.sarcodec.sicd;

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
 * Writes a SICD NITF. The plan is snapshotted and laid out at construction, when every
 * header and the SICD XML are written; pixels follow through {@link #writeImage}. The file
 * appears at its target path only after {@link #close()} confirms every pixel was written.
 *
 * <pre>{@code
 * try (var writer = new SicdNitfWriter(path, plan)) {
 *     writer.writeImage(pixels);
 * }
 * }</pre>
 */
@Slf4j
public class SicdNitfWriter extends ContainerWriter {
    private final SicdNitfPlan plan;
    private final SicdNitfLayout layout;

    public SicdNitfWriter(Path target, SicdNitfPlan plan) throws IOException, SarCodecException {
        this(target, plan, new SicdNitfPlanner());
    }

    public SicdNitfWriter(Path target, SicdNitfPlan plan, SicdNitfPlanner planner) throws IOException, SarCodecException {
        this(target, planner.layout(plan.snapshot()));
    }

    private SicdNitfWriter(Path target, SicdNitfLayout layout) throws IOException, SarCodecException {
        super(target, layout.getPlan());
        this.plan = layout.getModel();
        this.layout = layout;
        try {
            writeHeaders();
        } catch (IOException | SarCodecException | RuntimeException e) {
            abort();
            throw e;
        }
    }

    /**
     * The plan this writer works from, detached from the one passed in.
     */
    public SicdNitfPlan getPlan() {
        return plan;
    }

    public SicdNitfLayout getNitfLayout() {
        return layout;
    }

    /**
     * Writes the complete image.
     */
    public void writeImage(PayloadArray pixels) throws IOException, SarCodecException {
        var shape = pixels.getShape();
        if (shape.length != 2 || shape[0] != layout.getNumRows() || shape[1] != layout.getNumCols()) {
            throw new SarCodecException(ErrorType.PAYLOAD_MISMATCH, "Array shape " + Arrays.toString(shape)
                    + " does not match SICD shape [" + layout.getNumRows() + ", " + layout.getNumCols()
                    + "]; use writeImage(pixels, startRow, startCol) for part of the image");
        }
        writeImage(pixels, 0, 0);
    }

    /**
     * Writes a block of the image whose first pixel is at ({@code startRow}, {@code startCol}).
     * Blocks spanning several image segments are split between them. Nothing is written if the
     * block has the wrong element type or does not fit in the image.
     */
    public void writeImage(PayloadArray pixels, int startRow, int startCol) throws IOException, SarCodecException {
        var expected = layout.getPixelType().getDataType();
        if (!expected.equals(pixels.getDataType())) {
            throw new SarCodecException(ErrorType.PAYLOAD_MISMATCH, "Array element type " + pixels.getDataType()
                    + " does not match " + expected + " for PixelType=" + layout.getPixelType());
        }
        var shape = pixels.getShape();
        if (shape.length != 2 || startRow < 0 || startCol < 0
                || (long) startRow + shape[0] > layout.getNumRows()
                || (long) startCol + shape[1] > layout.getNumCols()) {
            throw new SarCodecException(ErrorType.PAYLOAD_MISMATCH, "Array of shape " + Arrays.toString(shape)
                    + " at (" + startRow + ", " + startCol + ") goes beyond the SICD shape ["
                    + layout.getNumRows() + ", " + layout.getNumCols() + "]");
        }
        int endRow = startRow + shape[0];
        for (int i = 0; i < layout.getImageSegments().size(); i++) {
            var info = layout.getImageSegments().get(i);
            int from = Math.max(startRow, info.getFirstRow());
            int to = Math.min(endRow, info.getFirstRow() + info.getNumRows());
            if (from >= to) continue;
            var part = from == startRow && to == endRow ? pixels : pixels.rows(from - startRow, to - from);
            writePayload(imageSegment(i).getIndex(), part, from - info.getFirstRow(), startCol);
        }
    }

    private void writeHeaders() throws IOException, SarCodecException {
        writeAt(segment(SicdNitfLayout.FILE_HEADER).getOffset(), layout.getFileHeaderBytes());
        for (int i = 0; i < layout.getImageSubheaderBytes().size(); i++) {
            writeAt(segment(SicdNitfLayout.imageSubheaderName(i)).getOffset(), layout.getImageSubheaderBytes().get(i));
        }
        writeAt(segment(SicdNitfLayout.DES_SUBHEADER).getOffset(), layout.getDesSubheaderBytes());
        writeAt(segment(SicdNitfLayout.SICD_XML).getOffset(), layout.getXmlBytes());
        log.debug("Wrote NITF headers and {} bytes of SICD XML for {} segments", layout.getXmlBytes().length,
                getLayout().getSegments().size());
    }

    private Segment imageSegment(int index) {
        return segment(SicdNitfLayout.imageSegmentName(index));
    }

    private Segment segment(String name) {
        return getLayout().find(name).orElseThrow(() -> new IllegalStateException("Layout has no segment " + name));
    }
}
