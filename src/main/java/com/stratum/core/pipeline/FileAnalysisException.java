package com.stratum.core.pipeline;

import com.stratum.core.StratumException;

/**
 * Fatal failure of one file's run, carrying the file identity and where it failed.
 */
public class FileAnalysisException extends StratumException {

    private final String fileId;
    private final String location;

    public FileAnalysisException(String fileId, String location, Throwable cause) {
        super("Processing " + fileId + " failed at " + location + ": " + cause.getMessage(), cause);
        this.fileId = fileId;
        this.location = location;
    }

    public String fileId() {
        return fileId;
    }

    /** Offending batch ("batch #3") or span ("PROCEDURE 4~2"). */
    public String location() {
        return location;
    }
}
