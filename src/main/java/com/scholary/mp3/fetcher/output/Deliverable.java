package com.scholary.mp3.fetcher.output;

import java.nio.file.Path;

/**
 * The file handed to the client at the end of a job.
 *
 * @param path the file inside the job directory
 * @param displayName the attachment name shown to the client
 * @param archive true if this is a zip of a collection
 * @param itemCount number of media files in the deliverable
 */
public record Deliverable(Path path, String displayName, boolean archive, int itemCount) {}
