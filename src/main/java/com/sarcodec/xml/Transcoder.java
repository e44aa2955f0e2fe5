package com.sarcodec.xml;

import com.sarcodec.error.ErrorType;
import com.sarcodec.error.SarCodecException;
import org.jdom2.Element;
import org.jdom2.Namespace;

import java.time.OffsetDateTime;
import java.util.Map;
import java.util.Set;

/**
 * Converts between one element of a metadata tree and a typed value. Implementations are
 * stateless; {@code decode(encode(v))} yields a value equal to {@code v}.
 *
 * @param <T> value type
 */
public interface Transcoder<T> {

    T decode(Element element) throws SarCodecException;

    /**
     * Replaces the content of {@code element} with the encoding of {@code value}.
     */
    void encode(Element element, T value) throws SarCodecException;

    /**
     * Sub-element transcoders keyed by slash-separated local names relative to the element
     * this transcoder handles. Registries register them alongside the composite.
     */
    default Map<String, Transcoder<?>> children() {
        return Map.of();
    }

    /**
     * Creates a detached element holding {@code value}.
     */
    default Element newElement(String localName, Namespace namespace, T value) throws SarCodecException {
        var element = new Element(localName, namespace);
        encode(element, value);
        return element;
    }

    Transcoder<String> TXT = new Transcoder<>() {
        @Override
        public String decode(Element element) {
            return element.getText();
        }

        @Override
        public void encode(Element element, String value) {
            element.setText(value);
        }
    };

    Transcoder<Long> INT = new Transcoder<>() {
        @Override
        public Long decode(Element element) throws SarCodecException {
            return XmlText.parseLong(element);
        }

        @Override
        public void encode(Element element, Long value) {
            element.setText(Long.toString(value));
        }
    };

    Transcoder<Double> DBL = new Transcoder<>() {
        @Override
        public Double decode(Element element) throws SarCodecException {
            return XmlText.parseDouble(element);
        }

        @Override
        public void encode(Element element, Double value) {
            element.setText(XmlText.formatDouble(value));
        }
    };

    /**
     * Angle in degrees within [-360, 360].
     */
    Transcoder<Double> ANGLE = new Transcoder<>() {
        @Override
        public Double decode(Element element) throws SarCodecException {
            double value = XmlText.parseDouble(element);
            if (!(Math.abs(value) <= 360.0)) {
                throw XmlText.malformed(element, "angle in [-360, 360]", XmlText.text(element), null);
            }
            return value;
        }

        @Override
        public void encode(Element element, Double value) throws SarCodecException {
            if (!(Math.abs(value) <= 360.0)) {
                throw new SarCodecException(ErrorType.INVALID_FIELD_VALUE, XmlTrees.describe(element)
                        + ": angle " + value + " outside [-360, 360]");
            }
            element.setText(XmlText.formatDouble(value));
        }
    };

    Transcoder<Boolean> BOOL = new Transcoder<>() {
        @Override
        public Boolean decode(Element element) throws SarCodecException {
            return XmlText.parseBoolean(element);
        }

        @Override
        public void encode(Element element, Boolean value) {
            element.setText(value ? "true" : "false");
        }
    };

    Transcoder<OffsetDateTime> XDT = new Transcoder<>() {
        @Override
        public OffsetDateTime decode(Element element) throws SarCodecException {
            return XmlText.parseDateTime(element);
        }

        @Override
        public void encode(Element element, OffsetDateTime value) {
            element.setText(XmlText.formatDateTime(value));
        }
    };

    Transcoder<byte[]> HEX = new Transcoder<>() {
        @Override
        public byte[] decode(Element element) throws SarCodecException {
            return XmlText.parseHex(element);
        }

        @Override
        public void encode(Element element, byte[] value) {
            element.setText(XmlText.formatHex(value));
        }
    };

    Transcoder<Complex> CMPLX = new Transcoder<>() {
        @Override
        public Complex decode(Element element) throws SarCodecException {
            return new Complex(DBL.decode(XmlTrees.requireChild(element, "Real")),
                    DBL.decode(XmlTrees.requireChild(element, "Imag")));
        }

        @Override
        public void encode(Element element, Complex value) {
            element.removeContent();
            XmlTrees.addChild(element, "Real", XmlText.formatDouble(value.getReal()));
            XmlTrees.addChild(element, "Imag", XmlText.formatDouble(value.getImag()));
        }

        @Override
        public Map<String, Transcoder<?>> children() {
            return Map.of("Real", DBL, "Imag", DBL);
        }
    };

    Transcoder<double[]> XY = new ArrayTranscoder("X", "Y");
    Transcoder<double[]> XYZ = new ArrayTranscoder("X", "Y", "Z");
    Transcoder<double[]> LAT_LON = new ArrayTranscoder("Lat", "Lon");
    Transcoder<double[]> LAT_LON_HAE = new ArrayTranscoder("Lat", "Lon", "HAE");
    Transcoder<double[]> LINE_SAMP = new ArrayTranscoder("Line", "Sample");
    Transcoder<long[]> ROW_COL = new IntArrayTranscoder("Row", "Col");

    Transcoder<Poly1d> POLY = new PolyTranscoder();
    Transcoder<Poly2d> POLY2D = new Poly2dTranscoder();
    Transcoder<XyzPoly> XYZ_POLY = new XyzPolyTranscoder();
    Transcoder<Parameter> PARAMETER = new ParameterTranscoder();

    /**
     * Text restricted to an enumeration.
     */
    static Transcoder<String> token(String... allowed) {
        var values = Set.of(allowed);
        return new Transcoder<>() {
            @Override
            public String decode(Element element) throws SarCodecException {
                var text = XmlText.text(element);
                if (!values.contains(text)) {
                    throw XmlText.malformed(element, "one of " + values, text, null);
                }
                return text;
            }

            @Override
            public void encode(Element element, String value) throws SarCodecException {
                if (!values.contains(value)) {
                    throw new SarCodecException(ErrorType.INVALID_FIELD_VALUE, XmlTrees.describe(element)
                            + ": expected one of " + values + " but got '" + value + "'");
                }
                element.setText(value);
            }
        };
    }
}
