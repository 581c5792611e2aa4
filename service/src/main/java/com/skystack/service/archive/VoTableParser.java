package com.skystack.service.archive;

import com.skystack.core.model.CelestialLocation;
import com.skystack.core.model.ExposureRecord;
import com.skystack.pipeline.api.ArchiveResponseException;
import com.skystack.pipeline.api.InvalidQueryException;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;
import org.xml.sax.ErrorHandler;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.net.URI;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

final class VoTableParser {
    static final String RA = "RA";
    static final String DEC = "DEC";
    static final String URL = "URL";
    static final String INSTRUMENT = "Instrument";

    private VoTableParser() {
    }

    static List<ExposureRecord> parse(byte[] xml) {
        Document document = read(xml);
        checkQueryStatus(document);

        NodeList tables = document.getElementsByTagNameNS("*", "TABLE");
        if (tables.getLength() == 0) {
            return List.of();
        }
        Element table = (Element) tables.item(0);
        NodeList rows = table.getElementsByTagNameNS("*", "TR");
        if (rows.getLength() == 0) {
            return List.of();
        }

        Map<String, Integer> columns = columns(table);
        int raColumn = required(columns, RA);
        int decColumn = required(columns, DEC);
        int urlColumn = required(columns, URL);
        Integer instrumentColumn = columns.get(INSTRUMENT.toLowerCase(Locale.ROOT));

        List<ExposureRecord> records = new ArrayList<>(rows.getLength());
        for (int i = 0; i < rows.getLength(); i++) {
            List<String> cells = cells((Element) rows.item(i));
            try {
                CelestialLocation location = new CelestialLocation(
                        Double.parseDouble(cell(cells, raColumn)),
                        Double.parseDouble(cell(cells, decColumn))
                );
                URI url = URI.create(cell(cells, urlColumn));
                String instrument = instrumentColumn == null ? "" : cell(cells, instrumentColumn);
                records.add(new ExposureRecord(location, url, instrument));
            } catch (IllegalArgumentException e) {
                throw new ArchiveResponseException("Malformed VOTable row " + (i + 1) + ": " + e.getMessage(), e);
            }
        }
        return records;
    }

    private static Document read(byte[] xml) {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
            factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
            factory.setExpandEntityReferences(false);

            DocumentBuilder builder = factory.newDocumentBuilder();
            builder.setErrorHandler(new ErrorHandler() {
                @Override
                public void warning(SAXParseException exception) {
                }

                @Override
                public void error(SAXParseException exception) throws SAXParseException {
                    throw exception;
                }

                @Override
                public void fatalError(SAXParseException exception) throws SAXParseException {
                    throw exception;
                }
            });
            return builder.parse(new ByteArrayInputStream(xml));
        } catch (ParserConfigurationException | SAXException | IOException e) {
            throw new ArchiveResponseException("Archive response is not a readable VOTable", e);
        }
    }

    private static void checkQueryStatus(Document document) {
        NodeList infos = document.getElementsByTagNameNS("*", "INFO");
        for (int i = 0; i < infos.getLength(); i++) {
            Element info = (Element) infos.item(i);
            if ("QUERY_STATUS".equals(info.getAttribute("name")) && "ERROR".equalsIgnoreCase(info.getAttribute("value"))) {
                String detail = info.getTextContent() == null ? "" : info.getTextContent().trim();
                throw new InvalidQueryException("Archive rejected query" + (detail.isEmpty() ? "" : ": " + detail));
            }
        }
    }

    private static Map<String, Integer> columns(Element table) {
        NodeList fields = table.getElementsByTagNameNS("*", "FIELD");
        Map<String, Integer> columns = new HashMap<>();
        for (int i = 0; i < fields.getLength(); i++) {
            Element field = (Element) fields.item(i);
            String name = field.getAttribute("name");
            if (name.isEmpty()) {
                name = field.getAttribute("ID");
            }
            columns.putIfAbsent(name.toLowerCase(Locale.ROOT), i);
        }
        return columns;
    }

    private static int required(Map<String, Integer> columns, String name) {
        Integer index = columns.get(name.toLowerCase(Locale.ROOT));
        if (index == null) {
            throw new ArchiveResponseException("VOTable has no " + name + " column");
        }
        return index;
    }

    private static List<String> cells(Element row) {
        NodeList data = row.getElementsByTagNameNS("*", "TD");
        List<String> cells = new ArrayList<>(data.getLength());
        for (int i = 0; i < data.getLength(); i++) {
            cells.add(data.item(i).getTextContent().trim());
        }
        return cells;
    }

    private static String cell(List<String> cells, int column) {
        if (column >= cells.size() || cells.get(column).isEmpty()) {
            throw new IllegalArgumentException("missing value in column " + (column + 1));
        }
        return cells.get(column);
    }
}
