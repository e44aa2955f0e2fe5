package com.sarcodec.layout;

import com.sarcodec.error.SarCodecException;

/**
 * Computes the segment layout of a container from its model before any byte is written.
 *
 * @param <M> per-format model type
 */
public interface LayoutPlanner<M> {

    /**
     * @throws SarCodecException LAYOUT_ERROR when a declared dimension or element size is
     *                           invalid or the file would exceed the format's offset width
     */
    LayoutPlan plan(M model) throws SarCodecException;
}
