package com.eyelevel.videosigning.service.job;

import java.nio.file.Path;

/**
 * Everything a background worker needs to sign one accepted submission.
 *
 * @param jobId        The persisted job record's ID.
 * @param stagedInput  The staged upload, owned exclusively by the worker running this task.
 * @param originalName The client-supplied filename, used to derive the output name.
 * @param contentHash  The hash recorded at acceptance, used to verify the staged bytes.
 */
public record SigningTask(Long jobId, Path stagedInput, String originalName, String contentHash) {

    public String contextInfo() {
        return "Job " + jobId;
    }
}
