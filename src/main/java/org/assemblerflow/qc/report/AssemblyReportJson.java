package org.assemblerflow.qc.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import org.assemblerflow.qc.assembly.AssemblySummary;
import org.assemblerflow.qc.assembly.ContigBoundaryMap;
import org.assemblerflow.qc.assembly.WindowTrack;
import org.assemblerflow.qc.utils.Utils;

import java.util.*;

/**
 * JSON document consumed by the reporting front end for one assembly:
 * a {@code tableRow} with the headline counts and a {@code plotData} entry with the contig size distribution and the
 * sliding window tracks.
 */
@JsonPropertyOrder({"tableRow", "plotData"})
public final class AssemblyReportJson {

    public static final String TABLE_NAME = "assembly";
    public static final String CONTIGS_HEADER = "Contigs";
    public static final String ASSEMBLED_BP_HEADER = "Assembled BP";

    @JsonPropertyOrder({"header", "value", "table"})
    public static final class TableCell {
        @JsonProperty("header")
        private final String header;
        @JsonProperty("value")
        private final long value;
        @JsonProperty("table")
        private final String table;

        public TableCell(final String header, final long value) {
            this.header = Utils.nonNull(header);
            this.value = value;
            this.table = TABLE_NAME;
        }

        public String getHeader() {
            return header;
        }

        public long getValue() {
            return value;
        }
    }

    @JsonPropertyOrder({"sample", "data"})
    public static final class TableRow {
        @JsonProperty("sample")
        private final String sample;
        @JsonProperty("data")
        private final List<TableCell> data;

        public TableRow(final String sample, final List<TableCell> data) {
            this.sample = Utils.nonNull(sample);
            this.data = Collections.unmodifiableList(new ArrayList<>(data));
        }

        public List<TableCell> getData() {
            return data;
        }
    }

    @JsonPropertyOrder({"gcData", "covData", "window", "xbars", "labels", "assemblyFile"})
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static final class GenomeSliding {
        @JsonProperty("gcData")
        private final List<Double> gcData;
        @JsonProperty("covData")
        private final List<Double> covData;
        @JsonProperty("window")
        private final int window;
        @JsonProperty("xbars")
        private final List<List<Object>> xbars;
        @JsonProperty("labels")
        private final List<String> labels;
        @JsonProperty("assemblyFile")
        private final String assemblyFile;

        /**
         * @param coverageTrack may be null when no per-base depth is available
         */
        public GenomeSliding(final WindowTrack gcTrack, final WindowTrack coverageTrack, final String assemblyFile) {
            Utils.nonNull(gcTrack);
            this.gcData = gcTrack.getValues();
            this.covData = coverageTrack == null ? null : coverageTrack.getValues();
            this.window = gcTrack.getWindowSize();
            this.xbars = toXbars(gcTrack.getBoundaries());
            this.labels = gcTrack.getLabels();
            this.assemblyFile = Utils.nonNull(assemblyFile);
        }

        private static List<List<Object>> toXbars(final ContigBoundaryMap boundaries) {
            final List<List<Object>> bars = new ArrayList<>();
            for (final ContigBoundaryMap.Boundary boundary : boundaries.getBoundaries()) {
                bars.add(Arrays.asList(boundary.getContigId(), boundary.getEnd(), boundary.getHeader()));
            }
            return bars;
        }

        public List<Double> getGcData() {
            return gcData;
        }

        public List<Double> getCovData() {
            return covData;
        }

        public int getWindow() {
            return window;
        }

        public List<String> getLabels() {
            return labels;
        }
    }

    @JsonPropertyOrder({"size_dist", "sparkline", "genomeSliding"})
    public static final class PlotPayload {
        @JsonProperty("size_dist")
        private final List<Integer> sizeDistribution;
        @JsonProperty("sparkline")
        private final long sparkline;
        @JsonProperty("genomeSliding")
        private final GenomeSliding genomeSliding;

        public PlotPayload(final List<Integer> sizeDistribution, final long assembledBases, final GenomeSliding genomeSliding) {
            this.sizeDistribution = Collections.unmodifiableList(new ArrayList<>(sizeDistribution));
            this.sparkline = assembledBases;
            this.genomeSliding = Utils.nonNull(genomeSliding);
        }

        public List<Integer> getSizeDistribution() {
            return sizeDistribution;
        }

        public GenomeSliding getGenomeSliding() {
            return genomeSliding;
        }
    }

    @JsonPropertyOrder({"sample", "data"})
    public static final class PlotData {
        @JsonProperty("sample")
        private final String sample;
        @JsonProperty("data")
        private final PlotPayload data;

        public PlotData(final String sample, final PlotPayload data) {
            this.sample = Utils.nonNull(sample);
            this.data = Utils.nonNull(data);
        }

        public PlotPayload getData() {
            return data;
        }
    }

    @JsonProperty("tableRow")
    private final List<TableRow> tableRow;

    @JsonProperty("plotData")
    private final List<PlotData> plotData;

    public AssemblyReportJson(final TableRow tableRow, final PlotData plotData) {
        this.tableRow = Collections.singletonList(Utils.nonNull(tableRow));
        this.plotData = Collections.singletonList(Utils.nonNull(plotData));
    }

    /**
     * @param coverageTrack may be null, in which case {@code covData} is left out
     */
    public static AssemblyReportJson build(final String sampleId, final AssemblySummary summary, final List<Integer> contigLengths,
                                           final WindowTrack gcTrack, final WindowTrack coverageTrack, final String assemblyFile) {
        Utils.nonNull(sampleId);
        Utils.nonNull(summary);
        Utils.nonNull(contigLengths);
        final TableRow row = new TableRow(sampleId, Arrays.asList(
                new TableCell(CONTIGS_HEADER, summary.NCONTIGS),
                new TableCell(ASSEMBLED_BP_HEADER, summary.TOTAL_LEN)));
        final PlotPayload payload = new PlotPayload(contigLengths, summary.TOTAL_LEN,
                new GenomeSliding(gcTrack, coverageTrack, assemblyFile));
        return new AssemblyReportJson(row, new PlotData(sampleId, payload));
    }

    public List<TableRow> getTableRow() {
        return tableRow;
    }

    public List<PlotData> getPlotData() {
        return plotData;
    }
}
