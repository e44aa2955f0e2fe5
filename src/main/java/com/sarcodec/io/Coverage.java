package com.sarcodec.io;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntRBTreeSet;
import it.unimi.dsi.fastutil.longs.LongArrayList;
import it.unimi.dsi.fastutil.longs.LongArrays;

/**
 * Union of the row/column rectangles written to one data segment.
 */
final class Coverage {
    private final int rows;
    private final int cols;
    // row0, col0, row1, col1 (exclusive) per rectangle
    private final IntArrayList rectangles = new IntArrayList();

    Coverage(int rows, int cols) {
        this.rows = rows;
        this.cols = cols;
    }

    void add(int row, int col, int numRows, int numCols) {
        if (numRows == 0 || numCols == 0) return;
        rectangles.add(row);
        rectangles.add(col);
        rectangles.add(row + numRows);
        rectangles.add(col + numCols);
    }

    boolean isComplete() {
        return coveredCells() == (long) rows * cols;
    }

    /**
     * Area of the union, swept band by band between distinct row edges.
     */
    long coveredCells() {
        var edges = new IntRBTreeSet();
        for (int i = 0; i < rectangles.size(); i += 4) {
            edges.add(rectangles.getInt(i));
            edges.add(rectangles.getInt(i + 2));
        }
        long area = 0;
        int previous = -1;
        for (int edge : edges) {
            if (previous >= 0) {
                area += (long) (edge - previous) * coveredWidth(previous);
            }
            previous = edge;
        }
        return area;
    }

    private long coveredWidth(int row) {
        var spans = new LongArrayList();
        for (int i = 0; i < rectangles.size(); i += 4) {
            if (rectangles.getInt(i) <= row && row < rectangles.getInt(i + 2)) {
                spans.add(((long) rectangles.getInt(i + 1) << 32) | rectangles.getInt(i + 3));
            }
        }
        LongArrays.quickSort(spans.elements(), 0, spans.size());
        long width = 0;
        long end = 0;
        for (int i = 0; i < spans.size(); i++) {
            long start = spans.getLong(i) >>> 32;
            long stop = spans.getLong(i) & 0xFFFFFFFFL;
            if (stop > end) {
                width += stop - Math.max(start, end);
                end = stop;
            }
        }
        return width;
    }
}
