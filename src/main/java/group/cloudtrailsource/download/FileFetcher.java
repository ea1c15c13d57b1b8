package group.cloudtrailsource.download;

import group.cloudtrailsource.source.FileReference;

import java.util.List;

/**
 * Fetches the raw bytes of the file at {@code index} in the session's file list.
 * Callers ask for indexes in increasing order, one call per file.
 */
public interface FileFetcher {

    byte[] fetch(List<FileReference> files, int index);
}
