package com.sarcodec.nitf;

import com.sarcodec.header.FieldSpec;
import com.sarcodec.header.FieldTable;
import com.sarcodec.header.FieldType;
import com.sarcodec.header.HeaderFields;

import java.util.List;

import static com.sarcodec.header.FieldSpec.alpha;
import static com.sarcodec.header.FieldSpec.binary;
import static com.sarcodec.header.FieldSpec.extended;
import static com.sarcodec.header.FieldSpec.integer;
import static com.sarcodec.header.FieldSpec.numeric;

/**
 * NITF 2.1 header layouts: file header, image subheader, data extension subheader and the
 * user-defined subheader of XML_DATA_CONTENT data extensions.
 */
public final class NitfFieldTables {

    /** Offset of the HL (header length) field in the file header. */
    public static final int HL_OFFSET = 354;
    public static final FieldSpec HL = integer("HL", 6);

    public static final String XML_DATA_CONTENT = "XML_DATA_CONTENT";
    public static final int XML_DATA_CONTENT_DESSHL = 773;

    public static final FieldTable FILE_HEADER = FieldTable.builder("NITF file header")
            .field(alpha("FHDR", 4).withDefault("NITF").withAllowed("NITF"))
            .field(alpha("FVER", 5).withDefault("02.10").withAllowed("02.10"))
            .field(integer("CLEVEL", 2).withDefault(3L))
            .field(alpha("STYPE", 4).withDefault("BF01"))
            .field(alpha("OSTAID", 10))
            .field(numeric("FDT", 14))
            .field(extended("FTITLE", 80))
            .fields(securityFields("FS"))
            .field(integer("FSCOP", 5).withDefault(0L))
            .field(integer("FSCPYS", 5).withDefault(0L))
            .field(integer("ENCRYP", 1).withDefault(0L).withAllowed("0"))
            .field(binary("FBKGC", 3))
            .field(extended("ONAME", 24))
            .field(extended("OPHONE", 18))
            .field(integer("FL", 12))
            .field(HL)
            .field(integer("NUMI", 3).withDefault(0L))
            .repeat("NUMI", 3, integer("LISH", 6), integer("LI", 10))
            .field(integer("NUMS", 3).withDefault(0L))
            .repeat("NUMS", 3, integer("LSSH", 4), integer("LS", 6))
            .field(integer("NUMX", 3).withDefault(0L))
            .field(integer("NUMT", 3).withDefault(0L))
            .repeat("NUMT", 3, integer("LTSH", 4), integer("LT", 5))
            .field(integer("NUMDES", 3).withDefault(0L))
            .repeat("NUMDES", 3, integer("LDSH", 4), integer("LD", 9))
            .field(integer("NUMRES", 3).withDefault(0L))
            .repeat("NUMRES", 3, integer("LRESH", 4), integer("LRE", 7))
            .field(integer("UDHDL", 5).withDefault(0L))
            .when("UDHDL > 0", v -> v.getLong("UDHDL") > 0, b -> b
                    .field(integer("UDHOFL", 3))
                    .field(FieldSpec.variable("UDHD", FieldType.BINARY, "UDHDL", 3)))
            .field(integer("XHDL", 5).withDefault(0L))
            .when("XHDL > 0", v -> v.getLong("XHDL") > 0, b -> b
                    .field(integer("XHDLOFL", 3))
                    .field(FieldSpec.variable("XHD", FieldType.BINARY, "XHDL", 3)))
            .build();

    public static final FieldTable IMAGE_SUBHEADER = FieldTable.builder("NITF image subheader")
            .field(alpha("IM", 2).withDefault("IM").withAllowed("IM"))
            .field(alpha("IID1", 10))
            .field(numeric("IDATIM", 14))
            .field(alpha("TGTID", 17))
            .field(alpha("IID2", 80))
            .fields(securityFields("IS"))
            .field(integer("ENCRYP", 1).withDefault(0L).withAllowed("0"))
            .field(alpha("ISORCE", 42))
            .field(integer("NROWS", 8))
            .field(integer("NCOLS", 8))
            .field(alpha("PVTYPE", 3).withAllowed("INT", "B", "SI", "R", "C"))
            .field(alpha("IREP", 8))
            .field(alpha("ICAT", 8))
            .field(integer("ABPP", 2))
            .field(alpha("PJUST", 1).withDefault("R").withAllowed("L", "R"))
            .field(alpha("ICORDS", 1))
            .when("ICORDS not blank", v -> !v.getString("ICORDS").isEmpty(), b -> b
                    .field(alpha("IGEOLO", 60)))
            .field(integer("NICOM", 1).withDefault(0L))
            .repeat("NICOM", 1, extended("ICOM", 80))
            .field(alpha("IC", 2).withDefault("NC"))
            .when("IC compressed", v -> !isUncompressed(v.getString("IC")), b -> b
                    .field(alpha("COMRAT", 4)))
            .field(integer("NBANDS", 1))
            .when("NBANDS == 0", v -> v.getLong("NBANDS") == 0, b -> b
                    .field(integer("XBANDS", 5)))
            .repeat("NBANDS or XBANDS", NitfFieldTables::bandCount, 1,
                    alpha("IREPBAND", 2),
                    alpha("ISUBCAT", 6),
                    alpha("IFC", 1).withDefault("N"),
                    alpha("IMFLT", 3),
                    integer("NLUTS", 1).withDefault(0L).withAllowed("0"))
            .field(integer("ISYNC", 1).withDefault(0L))
            .field(alpha("IMODE", 1).withAllowed("B", "P", "R", "S"))
            .field(integer("NBPR", 4).withDefault(1L))
            .field(integer("NBPC", 4).withDefault(1L))
            .field(integer("NPPBH", 4))
            .field(integer("NPPBV", 4))
            .field(integer("NBPP", 2))
            .field(integer("IDLVL", 3))
            .field(integer("IALVL", 3))
            .field(numeric("ILOC", 10))
            .field(alpha("IMAG", 4).withDefault("1.0"))
            .field(integer("UDIDL", 5).withDefault(0L))
            .when("UDIDL > 0", v -> v.getLong("UDIDL") > 0, b -> b
                    .field(integer("UDOFL", 3))
                    .field(FieldSpec.variable("UDID", FieldType.BINARY, "UDIDL", 3)))
            .field(integer("IXSHDL", 5).withDefault(0L))
            .when("IXSHDL > 0", v -> v.getLong("IXSHDL") > 0, b -> b
                    .field(integer("IXSOFL", 3))
                    .field(FieldSpec.variable("IXSHD", FieldType.BINARY, "IXSHDL", 3)))
            .build();

    public static final FieldTable DES_SUBHEADER = FieldTable.builder("NITF data extension subheader")
            .field(alpha("DE", 2).withDefault("DE").withAllowed("DE"))
            .field(alpha("DESID", 25))
            .field(integer("DESVER", 2).withDefault(1L))
            .fields(securityFields("DES"))
            .when("DESID == TRE_OVERFLOW", v -> "TRE_OVERFLOW".equals(v.getString("DESID")), b -> b
                    .field(alpha("DESOFLW", 6))
                    .field(integer("DESITEM", 3)))
            .field(integer("DESSHL", 4).withDefault(0L))
            .when("XML_DATA_CONTENT user-defined subheader", NitfFieldTables::hasXmlDataContentFields, b -> b
                    .fields(xmlDataContentFields()))
            .when("other user-defined subheader",
                    v -> v.getLong("DESSHL") > 0 && !hasXmlDataContentFields(v), b -> b
                    .field(FieldSpec.variable("DESSHF", FieldType.EXTENDED, "DESSHL", 0)))
            .build();

    private NitfFieldTables() {
    }

    /**
     * The sixteen security fields shared by every NITF header, each name prefixed with
     * {@code prefix} ({@code FS}, {@code IS}, {@code DES}, ...).
     */
    public static List<FieldSpec> securityFields(String prefix) {
        return List.of(
                alpha(prefix + "CLAS", 1).withDefault("U").withAllowed("T", "S", "C", "R", "U"),
                alpha(prefix + "CLSY", 2),
                alpha(prefix + "CODE", 11),
                alpha(prefix + "CTLH", 2),
                alpha(prefix + "REL", 20),
                alpha(prefix + "DCTP", 2),
                alpha(prefix + "DCDT", 8),
                alpha(prefix + "DCXM", 4),
                alpha(prefix + "DG", 1),
                alpha(prefix + "DGDT", 8),
                alpha(prefix + "CLTX", 43),
                alpha(prefix + "CATP", 1),
                alpha(prefix + "CAUT", 40),
                alpha(prefix + "CRSN", 1),
                alpha(prefix + "SRDT", 8),
                alpha(prefix + "CTLN", 15));
    }

    private static List<FieldSpec> xmlDataContentFields() {
        return List.of(
                integer("DESCRC", 5).withDefault(99999L),
                alpha("DESSHFT", 8).withDefault("XML"),
                alpha("DESSHDT", 20),
                extended("DESSHRP", 40),
                extended("DESSHSI", 60),
                extended("DESSHSV", 10),
                extended("DESSHSD", 20),
                extended("DESSHTN", 120),
                extended("DESSHLPG", 125),
                extended("DESSHLPT", 25),
                extended("DESSHLI", 20),
                extended("DESSHLIN", 120),
                extended("DESSHABS", 200));
    }

    private static boolean hasXmlDataContentFields(HeaderFields values) {
        return XML_DATA_CONTENT.equals(values.getString("DESID"))
                && values.getLong("DESSHL") == XML_DATA_CONTENT_DESSHL;
    }

    private static boolean isUncompressed(String ic) {
        return "NC".equals(ic) || "NM".equals(ic);
    }

    private static int bandCount(HeaderFields values) {
        long nbands = values.getLong("NBANDS");
        return (int) (nbands != 0 ? nbands : values.getLong("XBANDS"));
    }
}
