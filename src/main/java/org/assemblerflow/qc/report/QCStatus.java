package org.assemblerflow.qc.report;

import org.assemblerflow.qc.utils.Utils;
import org.assemblerflow.qc.utils.io.IOUtils;

import java.nio.file.Path;

/**
 * The per-sample status token read by downstream orchestration to decide whether to continue with a sample.
 */
public enum QCStatus {
    PASS("pass"),
    FAIL("fail"),
    ERROR("error"),
    CORRUPT("corrupt");

    private final String token;

    QCStatus(final String token) {
        this.token = token;
    }

    public String getToken() {
        return token;
    }

    /**
     * Overwrites {@code statusFile} with this status' token.
     */
    public void write(final Path statusFile) {
        Utils.nonNull(statusFile);
        IOUtils.writeString(statusFile, token);
    }

    @Override
    public String toString() {
        return token;
    }
}
