package com.skystack.service.archive;

import com.skystack.core.model.CelestialLocation;
import com.skystack.core.model.ExposureRecord;
import com.skystack.pipeline.api.ArchiveResponseException;
import com.skystack.pipeline.api.InvalidQueryException;
import com.skystack.service.support.FixtureUtils;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class VoTableParserTest {
    @Test
    void readsRowsByFieldNameInArchiveOrder() {
        List<ExposureRecord> records = VoTableParser.parse(FixtureUtils.fixtureBytes("fixtures/hla-exposures.xml"));

        assertEquals(3, records.size());
        assertEquals(new CelestialLocation(201.365063, -43.019112), records.get(0).location());
        assertEquals(URI.create("https://hla.stsci.edu/cgi-bin/fitscut.cgi?red=ib1f01a&size=ALL&format=jpeg"),
                records.get(0).sourceUrl());
        assertEquals("WFC3/UVIS", records.get(0).instrument());
        assertEquals(records.get(0).location(), records.get(1).location());
        assertEquals(new CelestialLocation(201.401, -43.0), records.get(2).location());
    }

    @Test
    void emptyTableHasNoRows() {
        assertTrue(VoTableParser.parse(FixtureUtils.fixtureBytes("fixtures/hla-empty.xml")).isEmpty());
    }

    @Test
    void queryStatusErrorIsAnInvalidQuery() {
        InvalidQueryException error = assertThrows(InvalidQueryException.class,
                () -> VoTableParser.parse(FixtureUtils.fixtureBytes("fixtures/hla-error.xml")));

        assertTrue(error.getMessage().contains("Unknown instrument: WFC9"), error.getMessage());
    }

    @Test
    void malformedRowIsAResponseError() {
        ArchiveResponseException error = assertThrows(ArchiveResponseException.class,
                () -> VoTableParser.parse(FixtureUtils.fixtureBytes("fixtures/hla-malformed-row.xml")));

        assertTrue(error.getMessage().contains("row 1"), error.getMessage());
    }

    @Test
    void missingRequiredColumnIsAResponseError() {
        String xml = """
                <VOTABLE><RESOURCE><TABLE>
                  <FIELD name="RA"/><FIELD name="DEC"/>
                  <DATA><TABLEDATA><TR><TD>1.0</TD><TD>2.0</TD></TR></TABLEDATA></DATA>
                </TABLE></RESOURCE></VOTABLE>
                """;

        assertThrows(ArchiveResponseException.class, () -> VoTableParser.parse(xml.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void doctypeDeclarationsAreRefused() {
        String xml = """
                <?xml version="1.0"?>
                <!DOCTYPE VOTABLE [<!ENTITY x SYSTEM "file:///etc/passwd">]>
                <VOTABLE><RESOURCE/></VOTABLE>
                """;

        assertThrows(ArchiveResponseException.class, () -> VoTableParser.parse(xml.getBytes(StandardCharsets.UTF_8)));
    }

    @Test
    void htmlErrorPageIsAResponseError() {
        assertThrows(ArchiveResponseException.class,
                () -> VoTableParser.parse("<html><body>Maintenance".getBytes(StandardCharsets.UTF_8)));
    }
}
