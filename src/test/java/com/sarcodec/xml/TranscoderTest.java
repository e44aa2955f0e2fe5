package com.sarcodec.xml;

import com.sarcodec.error.ErrorType;
import com.sarcodec.error.SarCodecException;
import org.jdom2.Element;
import org.jdom2.Namespace;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class TranscoderTest {

    private static final Namespace NS = Namespace.getNamespace("urn:example");

    private static Element element(String name) {
        return new Element(name, NS);
    }

    private static Element element(String name, String text) {
        return element(name).setText(text);
    }

    @Nested
    class Primitives {

        @ParameterizedTest
        @ValueSource(doubles = {0.0, -1.5, 1e-300, 6378137.0, -0.001, Double.MAX_VALUE})
        void shouldRoundTripDoublesExactly(double value) throws SarCodecException {
            var e = Transcoder.DBL.newElement("V", NS, value);

            assertThat(Transcoder.DBL.decode(e)).isEqualTo(value);
        }

        @Test
        void shouldUseSchemaSpellingsForSpecialDoubles() throws SarCodecException {
            assertThat(Transcoder.DBL.newElement("V", NS, Double.NEGATIVE_INFINITY).getText()).isEqualTo("-INF");
            assertThat(Transcoder.DBL.decode(element("V", "INF"))).isEqualTo(Double.POSITIVE_INFINITY);
            assertThat(Transcoder.DBL.decode(element("V", "NaN"))).isNaN();
        }

        @ParameterizedTest
        @ValueSource(strings = {"", "abc", "1.0d", "Infinity", "0x10"})
        void shouldRejectNonSchemaDoubles(String text) {
            assertThatThrownBy(() -> Transcoder.DBL.decode(element("V", text)))
                    .isInstanceOf(SarCodecException.class)
                    .hasMessageContaining("/V")
                    .extracting("errorType")
                    .isEqualTo(ErrorType.MALFORMED_XML);
        }

        @Test
        void shouldParseIntegersWithSignAndWhitespace() throws SarCodecException {
            assertThat(Transcoder.INT.decode(element("N", " +42 "))).isEqualTo(42L);
            assertThat(Transcoder.INT.decode(element("N", "-7"))).isEqualTo(-7L);
        }

        @Test
        void shouldParseBooleansInBothForms() throws SarCodecException {
            assertThat(Transcoder.BOOL.decode(element("B", "1"))).isTrue();
            assertThat(Transcoder.BOOL.decode(element("B", "false"))).isFalse();
            assertThatThrownBy(() -> Transcoder.BOOL.decode(element("B", "yes")))
                    .isInstanceOf(SarCodecException.class);
        }

        @Test
        void shouldTreatDateTimesWithoutOffsetAsUtc() throws SarCodecException {
            var value = Transcoder.XDT.decode(element("T", "2024-03-01T12:30:00.5"));

            assertThat(value).isEqualTo(OffsetDateTime.of(2024, 3, 1, 12, 30, 0, 500_000_000, ZoneOffset.UTC));
            assertThat(Transcoder.XDT.decode(Transcoder.XDT.newElement("T", NS, value))).isEqualTo(value);
        }

        @Test
        void shouldRoundTripHex() throws SarCodecException {
            var e = Transcoder.HEX.newElement("H", NS, new byte[]{0x0A, (byte) 0xFF, 0x00});

            assertThat(e.getText()).isEqualTo("0AFF00");
            assertThat(Transcoder.HEX.decode(e)).containsExactly(0x0A, 0xFF, 0x00);
            assertThatThrownBy(() -> Transcoder.HEX.decode(element("H", "ABC")))
                    .isInstanceOf(SarCodecException.class);
        }

        @Test
        void shouldRejectAngleOutOfRange() {
            assertThatThrownBy(() -> Transcoder.ANGLE.decode(element("A", "361")))
                    .isInstanceOf(SarCodecException.class)
                    .extracting("errorType")
                    .isEqualTo(ErrorType.MALFORMED_XML);
            assertThatThrownBy(() -> Transcoder.ANGLE.newElement("A", NS, -400.0))
                    .isInstanceOf(SarCodecException.class)
                    .extracting("errorType")
                    .isEqualTo(ErrorType.INVALID_FIELD_VALUE);
        }

        @Test
        void shouldRestrictTokens() throws SarCodecException {
            var token = Transcoder.token("A", "B");

            assertThat(token.decode(element("T", " B "))).isEqualTo("B");
            assertThatThrownBy(() -> token.newElement("T", NS, "C"))
                    .isInstanceOf(SarCodecException.class)
                    .extracting("errorType")
                    .isEqualTo(ErrorType.INVALID_FIELD_VALUE);
        }
    }

    @Nested
    class Composites {

        @Test
        void shouldWriteNamedChildrenInNamespace() throws SarCodecException {
            var e = Transcoder.XYZ.newElement("ARPPos", NS, new double[]{1.0, -2.5, 3e7});

            assertThat(e.getChildren()).extracting(Element::getName).containsExactly("X", "Y", "Z");
            assertThat(e.getChildren()).allSatisfy(c -> assertThat(c.getNamespace()).isEqualTo(NS));
            assertThat(Transcoder.XYZ.decode(e)).containsExactly(1.0, -2.5, 3e7);
        }

        @Test
        void shouldRejectArrayOfWrongLength() {
            assertThatThrownBy(() -> Transcoder.LAT_LON.newElement("LL", NS, new double[]{1.0}))
                    .isInstanceOf(SarCodecException.class)
                    .extracting("errorType")
                    .isEqualTo(ErrorType.INVALID_FIELD_VALUE);
        }

        @Test
        void shouldRoundTripComplex() throws SarCodecException {
            var value = new Complex(-1.0, 0.25);

            assertThat(Transcoder.CMPLX.decode(Transcoder.CMPLX.newElement("C", NS, value))).isEqualTo(value);
        }

        @Test
        void shouldRoundTripRowCol() throws SarCodecException {
            var e = Transcoder.ROW_COL.newElement("RC", NS, new long[]{5727, -3});

            assertThat(Transcoder.ROW_COL.decode(e)).containsExactly(5727L, -3L);
        }

        @Test
        void shouldRoundTripHighOrderPolynomials() throws SarCodecException {
            var poly = Poly1d.of(1, 0, -3.5, 0, 0, 0, 1e-12);
            var e = Transcoder.POLY.newElement("P", NS, poly);

            assertThat(e.getAttributeValue("order1")).isEqualTo("6");
            assertThat(Transcoder.POLY.decode(e)).isEqualTo(poly);
            assertThat(poly.evaluate(2.0)).isCloseTo(1 - 14 + 64e-12, within(1e-15));
        }

        @Test
        void shouldDecodeSparsePolynomialDensely() throws SarCodecException {
            var e = element("P");
            XmlTrees.addChild(e, "Coef", "2.0").setAttribute("exponent1", "3");

            assertThat(Transcoder.POLY.decode(e).getCoefs()).containsExactly(0.0, 0.0, 0.0, 2.0);
        }

        @Test
        void shouldRoundTripPoly2d() throws SarCodecException {
            var poly = new Poly2d(new double[][]{{1, 2, 3}, {-4, 0, 0.5}});
            var e = Transcoder.POLY2D.newElement("P", NS, poly);

            assertThat(e.getAttributeValue("order1")).isEqualTo("1");
            assertThat(e.getAttributeValue("order2")).isEqualTo("2");
            assertThat(Transcoder.POLY2D.decode(e)).isEqualTo(poly);
            assertThat(poly.evaluate(2, 1)).isEqualTo(1 + 2 + 3 - 8 + 0 + 1.0);
        }

        @Test
        void shouldRoundTripPoly2dWithoutColumns() throws SarCodecException {
            var poly = new Poly2d(new double[2][0]);
            var e = Transcoder.POLY2D.newElement("P", NS, poly);

            assertThat(poly.getCoefs()).isEmpty();
            assertThat(XmlTrees.children(e, "Coef")).isEmpty();
            assertThat(Transcoder.POLY2D.decode(e)).isEqualTo(poly);
            assertThat(poly.evaluate(3, 4)).isZero();
        }

        @Test
        void shouldRoundTripXyzPoly() throws SarCodecException {
            var value = new XyzPoly(Poly1d.of(1, 2), Poly1d.of(-3), Poly1d.of(0, 0, 4));

            assertThat(Transcoder.XYZ_POLY.decode(Transcoder.XYZ_POLY.newElement("ARPPoly", NS, value))).isEqualTo(value);
            assertThat(value.evaluate(1.0)).containsExactly(3.0, -3.0, 4.0);
        }

        @Test
        void shouldRoundTripMatrixAndCheckShape() throws SarCodecException {
            var matrix = new Matrix(new double[][]{{1, 2}, {3, 4}, {5, 6}});
            var e = new MatrixTranscoder().newElement("M", NS, matrix);

            assertThat(e.getAttributeValue("size1")).isEqualTo("3");
            assertThat(new MatrixTranscoder().decode(e)).isEqualTo(matrix);
            assertThatThrownBy(() -> new MatrixTranscoder(2, 2).decode(e))
                    .isInstanceOf(SarCodecException.class)
                    .extracting("errorType")
                    .isEqualTo(ErrorType.MALFORMED_XML);
        }

        @Test
        void shouldRoundTripParameter() throws SarCodecException {
            var e = Transcoder.PARAMETER.newElement("Parameter", NS, new Parameter("mode", "spot"));

            assertThat(e.getAttributeValue("name")).isEqualTo("mode");
            assertThat(Transcoder.PARAMETER.decode(e)).isEqualTo(new Parameter("mode", "spot"));
        }
    }

    @Nested
    class Lists {

        private final ListTranscoder<double[]> vertices = new ListTranscoder<>("Vertex", Transcoder.LAT_LON);

        @Test
        void shouldIndexFromOneAndRecordSize() throws SarCodecException {
            var e = vertices.newElement("Polygon", NS, List.of(new double[]{1, 2}, new double[]{3, 4}));

            assertThat(e.getAttributeValue("size")).isEqualTo("2");
            assertThat(e.getChildren()).extracting(c -> c.getAttributeValue("index")).containsExactly("1", "2");
        }

        @Test
        void shouldSortByIndexOnDecode() throws SarCodecException {
            var e = element("Polygon");
            var second = XmlTrees.addChild(e, "Vertex");
            second.setAttribute("index", "2");
            Transcoder.LAT_LON.encode(second, new double[]{3, 4});
            var first = XmlTrees.addChild(e, "Vertex");
            first.setAttribute("index", "1");
            Transcoder.LAT_LON.encode(first, new double[]{1, 2});

            var decoded = vertices.decode(e);

            assertThat(decoded.get(0)).containsExactly(1.0, 2.0);
            assertThat(decoded.get(1)).containsExactly(3.0, 4.0);
        }

        @Test
        void shouldHandleEmptyLists() throws SarCodecException {
            var e = vertices.newElement("Polygon", NS, List.of());

            assertThat(e.getAttributeValue("size")).isEqualTo("0");
            assertThat(vertices.decode(e)).isEmpty();
        }

        @Test
        void shouldOrderImageCornersByLabel() throws SarCodecException {
            var corners = new ImageCornersTranscoder("ICP", ImageCornersTranscoder.SICD_LABELS);
            var value = new double[][]{{1, 2}, {3, 4}, {5, 6}, {7, 8}};
            var e = corners.newElement("ImageCorners", NS, value);

            assertThat(e.getChildren()).extracting(c -> c.getAttributeValue("index"))
                    .containsExactly("1:FRFC", "2:FRLC", "3:LRLC", "4:LRFC");
            assertThat(corners.decode(e)).isDeepEqualTo(value);
        }

        @Test
        void shouldRejectDuplicateCorner() throws SarCodecException {
            var corners = new ImageCornersTranscoder("ICP", ImageCornersTranscoder.SICD_LABELS);
            var e = corners.newElement("ImageCorners", NS, new double[][]{{1, 2}, {3, 4}, {5, 6}, {7, 8}});
            e.getChildren().get(3).setAttribute("index", "1:FRFC");

            assertThatThrownBy(() -> corners.decode(e))
                    .isInstanceOf(SarCodecException.class)
                    .extracting("errorType")
                    .isEqualTo(ErrorType.MALFORMED_XML);
        }

        @Test
        void shouldDecodeSequenceMembersPresent() throws SarCodecException {
            var members = new LinkedHashMap<String, Transcoder<?>>();
            members.put("Name", Transcoder.TXT);
            members.put("Offset", Transcoder.INT);
            members.put("Format", Transcoder.TXT);
            var sequence = new SequenceTranscoder(members);
            var value = new LinkedHashMap<String, Object>();
            value.put("Name", "Extra");
            value.put("Offset", 12L);

            var e = sequence.newElement("AddedPVP", NS, value);

            assertThat(e.getChildren()).extracting(Element::getName).containsExactly("Name", "Offset");
            assertThat(sequence.decode(e)).isEqualTo(value);
            assertThatThrownBy(() -> sequence.newElement("AddedPVP", NS, Map.of("Bogus", "x")))
                    .isInstanceOf(SarCodecException.class)
                    .extracting("errorType")
                    .isEqualTo(ErrorType.INVALID_FIELD_VALUE);
        }
    }
}
