package group.cloudtrailsource.download;

import group.cloudtrailsource.SourceException;
import group.cloudtrailsource.source.FileReference;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;

public class LocalFileReader implements FileFetcher {

    @Override
    public byte[] fetch(List<FileReference> files, int index) {
        FileReference file = files.get(index);
        try {
            return Files.readAllBytes(Path.of(file.name()));
        } catch (NoSuchFileException e) {
            throw new SourceException(SourceException.Kind.NO_INPUT, "downloader", "file vanished: " + file.name(), e);
        } catch (IOException e) {
            throw new SourceException(SourceException.Kind.IO, "downloader", "cannot read " + file.name() + ": " + e.getMessage(), e);
        }
    }
}
