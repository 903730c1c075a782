package com.github.conjugador.dumps;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamException;

import org.apache.commons.compress.compressors.CompressorException;
import org.apache.commons.compress.compressors.CompressorStreamFactory;
import org.apache.commons.io.IOUtils;

/**
 * Reads a MediaWiki XML dump, either plain or compressed in any format recognized by
 * Commons Compress (bzip2, gzip, xz...).
 */
public class XMLDumpReader {
    private final InputStream is;

    public XMLDumpReader(InputStream is) {
        this.is = Objects.requireNonNull(is);
    }

    public XMLDumpReader(Path path) throws IOException {
        this(Files.newInputStream(Objects.requireNonNull(path)));
    }

    protected InputStream getInputStream() {
        var bis = new BufferedInputStream(is);

        try {
            return new CompressorStreamFactory(true).createCompressorInputStream(bis);
        } catch (CompressorException e) {
            return bis; // assume uncompressed
        }
    }

    /**
     * Streams all revisions in document order. The returned stream must be closed, which
     * also closes the underlying input stream.
     */
    public Stream<XMLRevision> getStAXReaderStream() {
        var input = getInputStream();

        try {
            var factory = XMLInputFactory.newInstance();
            factory.setProperty(XMLInputFactory.SUPPORT_DTD, false);
            factory.setProperty(XMLInputFactory.IS_COALESCING, true);

            var streamReader = factory.createXMLStreamReader(input);
            var staxReader = new StAXDumpReader(streamReader);

            return StreamSupport.stream(staxReader.spliterator(), false).onClose(() -> {
                try {
                    streamReader.close();
                    input.close();
                } catch (XMLStreamException e) {
                    throw new UncheckedIOException(new IOException(e));
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            });
        } catch (XMLStreamException e) {
            IOUtils.closeQuietly(input);
            throw new UncheckedIOException(new IOException(e));
        }
    }
}
