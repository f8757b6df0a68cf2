package io.github.nicechester.commentariat.model;

import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * The 66 books of the Protestant canon in Scripture order.
 *
 * <p>Each constant carries its display name and the spellings accepted for it besides the
 * display name itself. Aliases are written in compact form (lower case, no spaces); lookups
 * go through {@link io.github.nicechester.commentariat.service.CanonTable}, which applies
 * the same normalization to both sides.
 */
public enum CanonicalBook {

    // Old Testament
    GENESIS("Genesis", Testament.OLD, "gen", "ge", "gn"),
    EXODUS("Exodus", Testament.OLD, "exod", "exo", "ex"),
    LEVITICUS("Leviticus", Testament.OLD, "lev", "lv", "levit"),
    NUMBERS("Numbers", Testament.OLD, "num", "nm", "nb"),
    DEUTERONOMY("Deuteronomy", Testament.OLD, "deut", "dt", "deu"),
    JOSHUA("Joshua", Testament.OLD, "josh", "jos", "jsh"),
    JUDGES("Judges", Testament.OLD, "judg", "jdg", "jdgs", "jgs"),
    RUTH("Ruth", Testament.OLD, "ru", "rth"),
    FIRST_SAMUEL("1 Samuel", Testament.OLD, "1sam", "1sa", "1sm", "isamuel", "firstsamuel"),
    SECOND_SAMUEL("2 Samuel", Testament.OLD, "2sam", "2sa", "2sm", "iisamuel", "secondsamuel"),
    FIRST_KINGS("1 Kings", Testament.OLD, "1kgs", "1ki", "1k", "ikings", "firstkings"),
    SECOND_KINGS("2 Kings", Testament.OLD, "2kgs", "2ki", "2k", "iikings", "secondkings"),
    FIRST_CHRONICLES("1 Chronicles", Testament.OLD, "1chr", "1chron", "1ch", "ichronicles", "firstchronicles"),
    SECOND_CHRONICLES("2 Chronicles", Testament.OLD, "2chr", "2chron", "2ch", "iichronicles", "secondchronicles"),
    EZRA("Ezra", Testament.OLD, "ezr"),
    NEHEMIAH("Nehemiah", Testament.OLD, "neh", "ne"),
    ESTHER("Esther", Testament.OLD, "esth", "est", "es"),
    JOB("Job", Testament.OLD, "jb"),
    PSALMS("Psalms", Testament.OLD, "ps", "psa", "psalm", "pss"),
    PROVERBS("Proverbs", Testament.OLD, "prov", "pr", "prv"),
    ECCLESIASTES("Ecclesiastes", Testament.OLD, "eccl", "ecc", "ec", "qoh"),
    SONG_OF_SOLOMON("Song of Solomon", Testament.OLD, "song", "songofsongs", "cant", "canticles", "sos"),
    ISAIAH("Isaiah", Testament.OLD, "isa", "is"),
    JEREMIAH("Jeremiah", Testament.OLD, "jer", "je"),
    LAMENTATIONS("Lamentations", Testament.OLD, "lam", "la"),
    EZEKIEL("Ezekiel", Testament.OLD, "ezek", "eze", "ezk"),
    DANIEL("Daniel", Testament.OLD, "dan", "da", "dn"),
    HOSEA("Hosea", Testament.OLD, "hos", "ho"),
    JOEL("Joel", Testament.OLD, "joe", "jl"),
    AMOS("Amos", Testament.OLD, "am"),
    OBADIAH("Obadiah", Testament.OLD, "obad", "ob", "oba"),
    JONAH("Jonah", Testament.OLD, "jon", "jh"),
    MICAH("Micah", Testament.OLD, "mic", "mc"),
    NAHUM("Nahum", Testament.OLD, "nah", "na"),
    HABAKKUK("Habakkuk", Testament.OLD, "hab", "hb"),
    ZEPHANIAH("Zephaniah", Testament.OLD, "zeph", "zep", "zp"),
    HAGGAI("Haggai", Testament.OLD, "hag", "hg"),
    ZECHARIAH("Zechariah", Testament.OLD, "zech", "zec", "zc"),
    MALACHI("Malachi", Testament.OLD, "mal", "ml"),

    // New Testament
    MATTHEW("Matthew", Testament.NEW, "matt", "mt", "mat"),
    MARK("Mark", Testament.NEW, "mr", "mk", "mrk"),
    LUKE("Luke", Testament.NEW, "lk", "lu", "luk"),
    JOHN("John", Testament.NEW, "jn", "jhn"),
    ACTS("Acts", Testament.NEW, "ac", "act"),
    ROMANS("Romans", Testament.NEW, "rom", "ro", "rm"),
    FIRST_CORINTHIANS("1 Corinthians", Testament.NEW, "1cor", "1co", "icor", "icorinthians", "firstcorinthians"),
    SECOND_CORINTHIANS("2 Corinthians", Testament.NEW, "2cor", "2co", "iicor", "iicorinthians", "secondcorinthians"),
    GALATIANS("Galatians", Testament.NEW, "gal", "ga"),
    EPHESIANS("Ephesians", Testament.NEW, "eph", "ep"),
    PHILIPPIANS("Philippians", Testament.NEW, "phil", "php", "phl"),
    COLOSSIANS("Colossians", Testament.NEW, "col", "co"),
    FIRST_THESSALONIANS("1 Thessalonians", Testament.NEW, "1thess", "1th", "ithess", "firstthessalonians"),
    SECOND_THESSALONIANS("2 Thessalonians", Testament.NEW, "2thess", "2th", "iithess", "secondthessalonians"),
    FIRST_TIMOTHY("1 Timothy", Testament.NEW, "1tim", "1ti", "itimothy", "firsttimothy"),
    SECOND_TIMOTHY("2 Timothy", Testament.NEW, "2tim", "2ti", "iitimothy", "secondtimothy"),
    TITUS("Titus", Testament.NEW, "tit", "ti"),
    PHILEMON("Philemon", Testament.NEW, "phlm", "phm", "philem"),
    HEBREWS("Hebrews", Testament.NEW, "heb", "he"),
    JAMES("James", Testament.NEW, "jas", "jam", "jm"),
    FIRST_PETER("1 Peter", Testament.NEW, "1pet", "1pe", "ipeter", "firstpeter"),
    SECOND_PETER("2 Peter", Testament.NEW, "2pet", "2pe", "iipeter", "secondpeter"),
    FIRST_JOHN("1 John", Testament.NEW, "1jn", "1jo", "ijohn", "firstjohn"),
    SECOND_JOHN("2 John", Testament.NEW, "2jn", "2jo", "iijohn", "secondjohn"),
    THIRD_JOHN("3 John", Testament.NEW, "3jn", "3jo", "iiijohn", "thirdjohn"),
    JUDE("Jude", Testament.NEW, "jud", "jd"),
    REVELATION("Revelation", Testament.NEW, "rev", "re", "apocalypse", "revelations");

    private final String displayName;
    private final Testament testament;
    private final List<String> aliases;

    CanonicalBook(String displayName, Testament testament, String... aliases) {
        this.displayName = displayName;
        this.testament = testament;
        this.aliases = List.of(aliases);
    }

    public String displayName() {
        return displayName;
    }

    public Testament testament() {
        return testament;
    }

    /**
     * 1-based position in canonical order (Genesis = 1, Revelation = 66).
     */
    public int position() {
        return ordinal() + 1;
    }

    /**
     * Accepted spellings other than the display name, sorted and without duplicates.
     */
    public Set<String> aliases() {
        return new TreeSet<>(aliases);
    }

    @Override
    public String toString() {
        return displayName;
    }
}
