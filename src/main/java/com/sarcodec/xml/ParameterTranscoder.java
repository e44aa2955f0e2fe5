package com.sarcodec.xml;

import com.sarcodec.error.ErrorType;
import com.sarcodec.error.SarCodecException;
import org.jdom2.Element;

/**
 * {@code <Parameter name="...">value</Parameter>}.
 */
public class ParameterTranscoder implements Transcoder<Parameter> {

    @Override
    public Parameter decode(Element element) throws SarCodecException {
        var name = element.getAttributeValue("name");
        if (name == null) {
            throw new SarCodecException(ErrorType.MALFORMED_XML, XmlTrees.describe(element) + " has no 'name' attribute");
        }
        return new Parameter(name, element.getText());
    }

    @Override
    public void encode(Element element, Parameter value) {
        element.setAttribute("name", value.getName());
        element.setText(value.getValue());
    }
}
