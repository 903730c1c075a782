package com.github.conjugador.dumps;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;

import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;

/**
 * Iterates over the revisions of a MediaWiki XML export, in document order.
 */
public final class StAXDumpReader implements Iterable<XMLRevision> {
    public static final int BASIC_CHARACTERISTICS = Spliterator.IMMUTABLE | Spliterator.NONNULL | Spliterator.ORDERED;

    private final XMLStreamReader streamReader;

    public StAXDumpReader(XMLStreamReader streamReader) {
        this.streamReader = streamReader;
    }

    @Override
    public Iterator<XMLRevision> iterator() {
        return new StAXIterator();
    }

    @Override
    public Spliterator<XMLRevision> spliterator() {
        return Spliterators.spliteratorUnknownSize(iterator(), BASIC_CHARACTERISTICS);
    }

    private class StAXIterator implements Iterator<XMLRevision> {
        private final StringBuilder buffer;
        private final PageInfo pageInfo;
        private boolean appendable;
        private boolean atRevision;

        public StAXIterator() {
            buffer = new StringBuilder(100000);
            pageInfo = new PageInfo();
            appendable = false;
            atRevision = false;
        }

        @Override
        public boolean hasNext() {
            if (atRevision) {
                return true;
            }

            try {
                XMLConsumer consumer = null;

                while (streamReader.hasNext() && streamReader.next() != XMLStreamConstants.END_DOCUMENT) {
                    if (streamReader.getEventType() == XMLStreamConstants.START_ELEMENT) {
                        if (streamReader.getLocalName().equals("page")) {
                            consumer = new PageConsumer(pageInfo);
                            continue;
                        } else if (streamReader.getLocalName().equals("revision")) {
                            atRevision = true;
                            return true;
                        }
                    }

                    if (consumer != null) {
                        parseCurrentElement(consumer);
                    }
                }

                return false;
            } catch (XMLStreamException e) {
                throw new UncheckedIOException(new IOException(e));
            }
        }

        @Override
        public XMLRevision next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }

            atRevision = false;

            try {
                var revision = pageInfo.makeRevision();
                var consumer = new RevisionConsumer(revision);

                while (!(streamReader.next() == XMLStreamConstants.END_ELEMENT && streamReader.getLocalName().equals("revision"))) {
                    parseCurrentElement(consumer);
                }

                return revision;
            } catch (XMLStreamException e) {
                throw new UncheckedIOException(new IOException(e));
            }
        }

        private void parseCurrentElement(XMLConsumer consumer) {
            switch (streamReader.getEventType()) {
                case XMLStreamConstants.START_ELEMENT:
                    buffer.setLength(0);
                    appendable = true;
                    break;
                case XMLStreamConstants.CHARACTERS:
                case XMLStreamConstants.CDATA:
                    if (appendable) {
                        buffer.append(streamReader.getTextCharacters(), streamReader.getTextStart(), streamReader.getTextLength());
                    }

                    break;
                case XMLStreamConstants.END_ELEMENT:
                    if (appendable) {
                        consumer.acceptEndElement(streamReader, buffer);
                        appendable = false;
                    }

                    break;
            }
        }
    }

    private static class PageInfo {
        String title;
        int ns;
        long id;
        boolean isRedirect;

        void clear() {
            title = "";
            ns = 0;
            id = 0;
            isRedirect = false;
        }

        XMLRevision makeRevision() {
            var revision = new XMLRevision();
            revision.title = title;
            revision.ns = ns;
            revision.pageid = id;
            revision.isRedirect = isRedirect;
            return revision;
        }
    }

    private static interface XMLConsumer {
        void acceptEndElement(XMLStreamReader reader, StringBuilder sb);
    }

    private static class PageConsumer implements XMLConsumer {
        private final PageInfo page;

        PageConsumer(PageInfo pageInfo) {
            this.page = pageInfo;
            pageInfo.clear();
        }

        @Override
        public void acceptEndElement(XMLStreamReader reader, StringBuilder sb) {
            switch (reader.getLocalName()) {
                case "title":
                    page.title = sb.toString();
                    break;
                case "ns":
                    page.ns = Integer.parseInt(sb.toString().strip());
                    break;
                case "id":
                    page.id = Long.parseLong(sb.toString().strip());
                    break;
                case "redirect":
                    page.isRedirect = true;
                    break;
            }
        }
    }

    private static class RevisionConsumer implements XMLConsumer {
        private final XMLRevision revision;

        RevisionConsumer(XMLRevision revision) {
            this.revision = revision;
        }

        @Override
        public void acceptEndElement(XMLStreamReader reader, StringBuilder sb) {
            switch (reader.getLocalName()) {
                case "id":
                    // ignore if already set, e.g. contributor's id
                    if (revision.revid == 0) {
                        revision.revid = Long.parseLong(sb.toString().strip());
                    }
                    break;
                case "timestamp":
                    revision.timestamp = sb.toString();
                    break;
                case "text":
                    revision.text = sb.toString();
                    break;
            }
        }
    }
}
