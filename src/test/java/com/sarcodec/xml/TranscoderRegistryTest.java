package com.sarcodec.xml;

import com.sarcodec.error.ErrorType;
import com.sarcodec.error.SarCodecException;
import org.jdom2.Document;
import org.jdom2.Element;
import org.jdom2.Namespace;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.*;

class TranscoderRegistryTest {

    private static final String NS = "urn:example:1.0";

    private TranscoderRegistry registry;
    private XmlHelper xml;

    @BeforeEach
    void setUp() throws SarCodecException {
        registry = new TranscoderRegistry()
                .collapse("Group")
                .register("{*}Data/{*}Value", Transcoder.DBL)
                .register("{*}Data/{*}Count", Transcoder.INT)
                .register("{*}Data/{*}Position", Transcoder.XYZ)
                .register("{*}Info/{*}Group/{*}Desc", Transcoder.PARAMETER);
        var text = "<Root xmlns=\"" + NS + "\"><Data><Value>2.5</Value><Count>3</Count>"
                + "<Position><X>1</X><Y>2</Y><Z>3</Z></Position></Data>"
                + "<Info><Group><Group><Desc name=\"a\">b</Desc></Group></Group></Info></Root>";
        xml = new XmlHelper(XmlTrees.parse(text.getBytes(StandardCharsets.UTF_8)), registry);
    }

    @Test
    void shouldLoadTypedValues() throws SarCodecException {
        assertThat(xml.load("./{*}Data/{*}Value")).isEqualTo(2.5);
        assertThat(xml.load("./{*}Data/{*}Count", Long.class)).isEqualTo(3L);
        assertThat((double[]) xml.load("./{*}Data/{*}Position")).containsExactly(1.0, 2.0, 3.0);
    }

    @Test
    void shouldRegisterCompositeChildren() throws SarCodecException {
        assertThat(registry.isTranscodable("{*}Data/{*}Position/{*}Y")).isTrue();
        assertThat(xml.load("./{*}Data/{*}Position/{*}Y")).isEqualTo(2.0);
    }

    @Test
    void shouldReturnNullForAbsentElement() throws SarCodecException {
        var bare = new XmlHelper(new Document(new Element("Root", NS)), registry);

        assertThat(bare.load("./{*}Data/{*}Value")).isNull();
    }

    @Test
    void shouldRejectUnregisteredPaths() {
        assertThatThrownBy(() -> xml.load("./{*}Data/{*}Unknown"))
                .isInstanceOf(SarCodecException.class)
                .hasMessageContaining("Unknown")
                .extracting("errorType")
                .isEqualTo(ErrorType.NOT_TRANSCODABLE);
        assertThatThrownBy(() -> xml.set("./{*}Data", 1.0))
                .isInstanceOf(SarCodecException.class)
                .extracting("errorType")
                .isEqualTo(ErrorType.NOT_TRANSCODABLE);
    }

    @Test
    void shouldRejectValueOfWrongType() {
        assertThatThrownBy(() -> xml.load("./{*}Data/{*}Value", Long.class))
                .isInstanceOf(SarCodecException.class)
                .extracting("errorType")
                .isEqualTo(ErrorType.INVALID_FIELD_VALUE);
        assertThatThrownBy(() -> xml.set("./{*}Data/{*}Value", "text"))
                .isInstanceOf(SarCodecException.class)
                .extracting("errorType")
                .isEqualTo(ErrorType.INVALID_FIELD_VALUE);
    }

    @Test
    void shouldPreferExactRegistrationOverWildcard() {
        var exactPath = ElementPath.parse("{" + NS + "}Data/{" + NS + "}Value");
        registry.register(exactPath, Transcoder.TXT);

        assertThat(registry.lookup(exactPath)).containsSame(Transcoder.TXT);
        assertThat(registry.lookup(ElementPath.parse("{urn:other}Data/{urn:other}Value"))).containsSame(Transcoder.DBL);
    }

    @Test
    void shouldPreferMoreQualifiedWildcardPattern() {
        registry.register("{*}Data/{" + NS + "}Count", Transcoder.DBL);

        assertThat(registry.lookup(ElementPath.parse("{*}Data/{" + NS + "}Count"))).containsSame(Transcoder.DBL);
        assertThat(registry.lookup(ElementPath.parse("{*}Data/{*}Count"))).isPresent();
        assertThat(registry.lookup(ElementPath.parse("{*}Data/{urn:other}Count"))).containsSame(Transcoder.INT);
    }

    @Test
    void shouldCollapseNestedGroups() throws SarCodecException {
        assertThat(xml.load("./{*}Info/{*}Group/{*}Group/{*}Desc")).isEqualTo(new Parameter("a", "b"));
        assertThat(registry.isTranscodable("{*}Info/{*}Group/{*}Group/{*}Group/{*}Desc")).isTrue();
    }

    @Test
    void shouldCreateMissingAncestorsInParentNamespace() throws SarCodecException {
        var doc = new Document(new Element("Root", NS));
        var helper = new XmlHelper(doc, registry);

        helper.set("./{*}Data/{*}Position", new double[]{4, 5, 6});
        helper.set("./{*}Data/{*}Count", 9L);

        var data = doc.getRootElement().getChild("Data", Namespace.getNamespace(NS));
        assertThat(data).isNotNull();
        assertThat(data.getChildren()).extracting(Element::getName).containsExactly("Position", "Count");
        assertThat(helper.findText("./{*}Data/{*}Count")).isEqualTo("9");
        assertThat(helper.findAll("./{*}Data/{*}Position/{*}X")).hasSize(1);
    }

    @Test
    void shouldReplaceExistingValue() throws SarCodecException {
        xml.set("./{*}Data/{*}Value", -1.25);

        assertThat(xml.findAll("./{*}Data/{*}Value")).hasSize(1);
        assertThat(xml.load("./{*}Data/{*}Value")).isEqualTo(-1.25);
    }

    @Test
    void shouldParseAndSerializeStably() throws SarCodecException {
        var bytes = XmlTrees.serialize(xml.getDocument());

        assertThat(XmlTrees.serialize(XmlTrees.parse(bytes))).isEqualTo(bytes);
        assertThatThrownBy(() -> XmlTrees.parse("<Root>".getBytes(StandardCharsets.UTF_8)))
                .isInstanceOf(SarCodecException.class)
                .extracting("errorType")
                .isEqualTo(ErrorType.MALFORMED_XML);
    }

    @Test
    void shouldParseClarkNotation() {
        var path = ElementPath.parse("./{*}ImageData/{urn:x}NumRows/Plain");

        assertThat(path.getSegments()).extracting(PathSegment::isWildcard).containsExactly(true, false, false);
        assertThat(path.getSegments().get(2).getNamespace()).isEmpty();
        assertThat(path.toString()).isEqualTo("{*}ImageData/{urn:x}NumRows/Plain");
        assertThat(path.collapse("NumRows")).isEqualTo(path);
    }
}
