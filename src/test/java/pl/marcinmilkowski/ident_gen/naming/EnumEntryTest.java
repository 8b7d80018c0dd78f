package pl.marcinmilkowski.ident_gen.naming;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EnumEntryTest {

    @Test
    void testCommentWhitespaceCollapsed() {
        EnumEntry entry = new EnumEntry("POP", 1, "Population\n   total ");
        assertEquals("Population total", entry.comment());
    }

    @Test
    void testBlankCommentIsNull() {
        assertNull(new EnumEntry("POP", 1, " \n ").comment());
        assertNull(new EnumEntry("POP", 1).comment());
    }

    @Test
    void testInvalidNames() {
        assertThrows(InvalidNameException.class, () -> new EnumEntry("", 1));
        assertThrows(InvalidNameException.class, () -> new EnumEntry(null, 1));
        assertThrows(InvalidNameException.class, () -> new EnumEntry("1POP", 1));
        assertThrows(InvalidNameException.class, () -> new EnumEntry("POP-X", 1));
    }

    @Test
    void testCaseCheckedOnlyOnRequest() {
        assertEquals("pop", new EnumEntry("pop", 1).name());
        assertThrows(InvalidNameException.class, () -> EnumEntry.validateName("pop", true));
        EnumEntry.validateName("_2021", true);
        EnumEntry.validateName("POP_2021", true);
    }

    @Test
    void testToString() {
        assertEquals("POP = 1  # Population", new EnumEntry("POP", 1, "Population").toString());
        assertEquals("POP = -5", new EnumEntry("POP", -5).toString());
    }

    @Test
    void testWithName() {
        EnumEntry entry = new EnumEntry("POP", 7, "Population");
        EnumEntry renamed = entry.withName("POP_1");
        assertEquals("POP_1", renamed.name());
        assertEquals(7, renamed.value());
        assertEquals("Population", renamed.comment());
        assertEquals("POP", entry.name());
    }
}
