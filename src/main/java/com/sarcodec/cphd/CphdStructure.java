package com.sarcodec.cphd;

import com.sarcodec.data.BinaryFormat;
import com.sarcodec.data.DataField;
import com.sarcodec.data.DataType;
import com.sarcodec.error.ErrorType;
import com.sarcodec.error.SarCodecException;
import com.sarcodec.xml.XmlHelper;
import com.sarcodec.xml.XmlTrees;
import lombok.Value;
import org.jdom2.Element;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Array declarations of a CPHD XML: the {@code Data} branch plus the PVP record layout and
 * support array element formats. Both the planner and the reader derive their segments
 * from this.
 */
@Value
public class CphdStructure {
    private static final int BYTES_PER_WORD = 8;

    DataType signalType;
    DataType pvpType;
    List<Channel> channels;
    List<SupportArray> supportArrays;

    @Value
    public static class Channel {
        String identifier;
        int numVectors;
        int numSamples;
        long signalArrayByteOffset;
        long pvpArrayByteOffset;
    }

    @Value
    public static class SupportArray {
        String identifier;
        int numRows;
        int numCols;
        int bytesPerElement;
        long arrayByteOffset;
        DataType elementType;
    }

    public Optional<Channel> channel(String identifier) {
        return channels.stream().filter(c -> c.getIdentifier().equals(identifier)).findFirst();
    }

    public Optional<SupportArray> supportArray(String identifier) {
        return supportArrays.stream().filter(s -> s.getIdentifier().equals(identifier)).findFirst();
    }

    /**
     * @throws SarCodecException MALFORMED_XML when an array declaration is missing or
     *                           inconsistent, LAYOUT_ERROR for compressed signal arrays
     */
    public static CphdStructure parse(XmlHelper xml) throws SarCodecException {
        var data = xml.find("./{*}Data");
        if (data == null) {
            throw new SarCodecException(ErrorType.MALFORMED_XML, "CPHD XML has no Data branch");
        }
        if (XmlTrees.child(data, "SignalCompressionID") != null) {
            throw new SarCodecException(ErrorType.LAYOUT_ERROR, "Compressed CPHD signal arrays are not supported");
        }
        var signalType = BinaryFormat.parse(text(xml, data, "SignalArrayFormat"));
        int numBytesPvp = positiveInt(xml, data, "NumBytesPVP");
        var pvpType = pvpType(xml, numBytesPvp);

        var channels = new ArrayList<Channel>();
        for (var element : XmlTrees.children(data, "Channel")) {
            channels.add(new Channel(
                    text(xml, element, "Identifier"),
                    positiveInt(xml, element, "NumVectors"),
                    positiveInt(xml, element, "NumSamples"),
                    number(xml, element, "SignalArrayByteOffset"),
                    number(xml, element, "PVPArrayByteOffset")));
        }
        if (channels.isEmpty()) {
            throw new SarCodecException(ErrorType.MALFORMED_XML, "CPHD Data declares no Channel");
        }

        var supportArrays = new ArrayList<SupportArray>();
        for (var element : XmlTrees.children(data, "SupportArray")) {
            var identifier = text(xml, element, "Identifier");
            int bytesPerElement = positiveInt(xml, element, "BytesPerElement");
            var elementType = BinaryFormat.parse(elementFormat(xml, identifier));
            if (elementType.getItemSize() != bytesPerElement) {
                throw new SarCodecException(ErrorType.MALFORMED_XML, "Support array " + identifier + ": ElementFormat "
                        + elementType + " has " + elementType.getItemSize() + " bytes, BytesPerElement is " + bytesPerElement);
            }
            supportArrays.add(new SupportArray(identifier,
                    positiveInt(xml, element, "NumRows"),
                    positiveInt(xml, element, "NumCols"),
                    bytesPerElement,
                    number(xml, element, "ArrayByteOffset"),
                    elementType));
        }
        return new CphdStructure(signalType, pvpType, Collections.unmodifiableList(channels),
                Collections.unmodifiableList(supportArrays));
    }

    /**
     * One record field per PVP parameter at {@code Offset} words. Vector parameters such as
     * {@code TxPos} become one field per component named {@code TxPos.X}.
     */
    private static DataType pvpType(XmlHelper xml, int numBytesPvp) throws SarCodecException {
        var pvp = xml.find("./{*}PVP");
        if (pvp == null) {
            throw new SarCodecException(ErrorType.MALFORMED_XML, "CPHD XML has no PVP branch");
        }
        var fields = new ArrayList<DataField>();
        for (var element : pvp.getChildren()) {
            if (element.getName().equals("TxAntenna") || element.getName().equals("RcvAntenna")) {
                for (var nested : element.getChildren()) {
                    addPvpFields(xml, nested, fields);
                }
            } else {
                addPvpFields(xml, element, fields);
            }
        }
        try {
            return DataType.struct(fields, numBytesPvp);
        } catch (IllegalArgumentException e) {
            throw new SarCodecException(ErrorType.MALFORMED_XML, "PVP layout does not fit NumBytesPVP=" + numBytesPvp
                    + ": " + e.getMessage(), e);
        }
    }

    @SuppressWarnings("unchecked")
    private static void addPvpFields(XmlHelper xml, Element element, List<DataField> fields) throws SarCodecException {
        var value = (Map<String, Object>) xml.loadElem(element);
        var name = element.getName().equals("AddedPVP") ? (String) value.get("Name") : element.getName();
        var offset = (Long) value.get("Offset");
        var size = (Long) value.get("Size");
        var format = (String) value.get("Format");
        if (name == null || offset == null || size == null || format == null) {
            throw new SarCodecException(ErrorType.MALFORMED_XML, XmlTrees.describe(element)
                    + " needs Offset, Size and Format" + (element.getName().equals("AddedPVP") ? " and Name" : ""));
        }
        var type = BinaryFormat.parse(format);
        if (type.getItemSize() != size * BYTES_PER_WORD) {
            throw new SarCodecException(ErrorType.MALFORMED_XML, "PVP " + name + ": Format " + format + " has "
                    + type.getItemSize() + " bytes but Size is " + size + " words");
        }
        int base = Math.toIntExact(offset * BYTES_PER_WORD);
        if (type.getKind() == DataType.Kind.STRUCT) {
            for (var member : type.getFields()) {
                fields.add(new DataField(name + "." + member.getName(), member.getType(), base + member.getOffset()));
            }
        } else {
            fields.add(new DataField(name, type, base));
        }
    }

    private static String elementFormat(XmlHelper xml, String identifier) throws SarCodecException {
        var branch = xml.find("./{*}SupportArray");
        if (branch != null) {
            for (var element : branch.getChildren()) {
                var id = XmlTrees.child(element, "Identifier");
                if (id != null && id.getTextTrim().equals(identifier)) {
                    return text(xml, element, "ElementFormat");
                }
            }
        }
        throw new SarCodecException(ErrorType.MALFORMED_XML, "No SupportArray parameters for identifier " + identifier);
    }

    private static String text(XmlHelper xml, Element parent, String name) throws SarCodecException {
        return (String) xml.loadElem(XmlTrees.requireChild(parent, name));
    }

    private static long number(XmlHelper xml, Element parent, String name) throws SarCodecException {
        var value = (Long) xml.loadElem(XmlTrees.requireChild(parent, name));
        if (value < 0) {
            throw new SarCodecException(ErrorType.MALFORMED_XML, XmlTrees.describe(parent) + "/" + name
                    + " cannot be negative: " + value);
        }
        return value;
    }

    private static int positiveInt(XmlHelper xml, Element parent, String name) throws SarCodecException {
        long value = number(xml, parent, name);
        if (value == 0 || value > Integer.MAX_VALUE) {
            throw new SarCodecException(ErrorType.LAYOUT_ERROR, XmlTrees.describe(parent) + "/" + name
                    + " must be positive and fit an int, got " + value);
        }
        return (int) value;
    }
}
