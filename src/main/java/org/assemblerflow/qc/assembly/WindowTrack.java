package org.assemblerflow.qc.assembly;

import org.assemblerflow.qc.utils.Utils;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A positional profile: one aggregate value per non-overlapping window, labelled with the contig the window
 * starts in, plus the contig boundaries the labels were assigned from.
 */
public final class WindowTrack {

    public static final class Window {
        private final double value;
        private final String label;
        private final long position;

        public Window(final double value, final String label, final long position) {
            this.value = value;
            this.label = Utils.nonNull(label);
            this.position = position;
        }

        public double getValue() {
            return value;
        }

        /**
         * Contig id covering {@link #getPosition()}.
         */
        public String getLabel() {
            return label;
        }

        /**
         * Absolute offset of the first element of the window.
         */
        public long getPosition() {
            return position;
        }

        @Override
        public String toString() {
            return position + ":" + label + "=" + value;
        }
    }

    private final int windowSize;
    private final List<Window> windows;
    private final ContigBoundaryMap boundaries;

    public WindowTrack(final int windowSize, final List<Window> windows, final ContigBoundaryMap boundaries) {
        Utils.validateArg(windowSize > 0, "window size must be positive");
        this.windowSize = windowSize;
        this.windows = Collections.unmodifiableList(Utils.nonNull(windows));
        this.boundaries = Utils.nonNull(boundaries);
    }

    public int getWindowSize() {
        return windowSize;
    }

    public List<Window> getWindows() {
        return windows;
    }

    public ContigBoundaryMap getBoundaries() {
        return boundaries;
    }

    public List<Double> getValues() {
        return windows.stream().map(Window::getValue).collect(Collectors.toList());
    }

    public List<String> getLabels() {
        return windows.stream().map(Window::getLabel).collect(Collectors.toList());
    }

    public List<Long> getPositions() {
        return windows.stream().map(Window::getPosition).collect(Collectors.toList());
    }

    public int size() {
        return windows.size();
    }
}
