package dev.sfc.xml;

import org.junit.jupiter.api.Test;
import org.w3c.dom.Element;

import static org.assertj.core.api.Assertions.assertThat;

class ElementsTest {

    private final Element root = TestXml.parse("""
        <Step ID="4" Operand=" Step_002 " Empty="">
          <Action><Body><STContent>
            <Line Number="0"><![CDATA[A := 1;]]></Line>
            <Line Number="1">   </Line>
            <Line Number="2">B := 2;</Line>
          </STContent></Body></Action>
          <Action><Body><STContent>
            <Line Number="0"><![CDATA[C := 3;]]></Line>
          </STContent></Body></Action>
          <Other><Action/></Other>
        </Step>
        """);

    @Test
    void childrenOnlyReturnsDirectChildrenWithTag() {
        assertThat(Elements.children(root, "Action")).hasSize(2);
        assertThat(Elements.children(root, "Missing")).isEmpty();
        assertThat(Elements.children(null, "Action")).isEmpty();
    }

    @Test
    void pathFollowsTagsInDocumentOrder() {
        var contents = Elements.path(root, "Action/Body/STContent");

        assertThat(contents).hasSize(2);
        assertThat(Elements.stLines(contents.get(0))).containsExactly("A := 1;", "B := 2;");
        assertThat(Elements.stLines(contents.get(1))).containsExactly("C := 3;");
        assertThat(Elements.firstPath(root, "Action/Nope")).isNull();
    }

    @Test
    void attributeTreatsMissingAndBlankAsNull() {
        assertThat(Elements.attribute(root, "ID")).isEqualTo("4");
        assertThat(Elements.attribute(root, "Operand")).isEqualTo("Step_002");
        assertThat(Elements.attribute(root, "Empty")).isNull();
        assertThat(Elements.attribute(root, "Missing")).isNull();
        assertThat(Elements.attribute(null, "ID")).isNull();
    }

    @Test
    void stLinesKeepIndentation() {
        Element content = TestXml.parse("""
            <STContent>
              <Line Number="0"><![CDATA[IF Run THEN]]></Line>
              <Line Number="1"><![CDATA[    Motor := 1;]]></Line>
              <Line Number="2"><![CDATA[]]></Line>
              <Line Number="3"><![CDATA[END_IF;]]></Line>
            </STContent>
            """);

        assertThat(Elements.stLines(content)).containsExactly("IF Run THEN", "    Motor := 1;", "END_IF;");
    }

    @Test
    void stLinesOfMissingContentIsEmpty() {
        assertThat(Elements.stLines(null)).isEmpty();
    }

    @Test
    void findDescendantMatchesAttributeValue() {
        Element tag = TestXml.parse("""
            <Tag Name="Step_004">
              <Data><Structure>
                <DataValueMember Name="DN" Value="0"/>
                <DataValueMember Name="PRE" Value="500"/>
              </Structure></Data>
            </Tag>
            """);

        Element pre = Elements.findDescendant(tag, "Name", "PRE");

        assertThat(pre).isNotNull();
        assertThat(pre.getAttribute("Value")).isEqualTo("500");
        assertThat(Elements.findDescendant(tag, "Name", "Step_004")).isNull();
    }
}
