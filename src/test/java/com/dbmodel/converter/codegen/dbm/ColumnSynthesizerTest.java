package com.dbmodel.converter.codegen.dbm;

import com.dbmodel.converter.codegen.context.SynthesisContext;
import com.dbmodel.converter.exception.ConversionError;
import com.dbmodel.converter.exception.ConversionException;
import com.dbmodel.converter.model.Column;
import com.dbmodel.converter.model.Table;
import com.dbmodel.converter.parser.XmlElements;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.List;

import static com.dbmodel.converter.SchemaFixtures.column;
import static com.dbmodel.converter.SchemaFixtures.config;
import static com.dbmodel.converter.SchemaFixtures.context;
import static com.dbmodel.converter.SchemaFixtures.userType;
import static org.assertj.core.api.Assertions.*;

class ColumnSynthesizerTest {

    private final ColumnSynthesizer synthesizer = new ColumnSynthesizer(
            new DomainSynthesizer(), new EnumTypeSynthesizer(), new TimestampTriggerSynthesizer());

    private SynthesisContext ctx;
    private Element tableElement;
    private List<Element> constraints;

    @BeforeEach
    void setUp() {
        ctx = context();
        tableElement = ctx.getDocument().createElement("table");
        constraints = new ArrayList<>();
    }

    private Element convert(Column column) {
        return convert(Table.builder().id("t-orders").name("orders").column(column).build(), column);
    }

    private Element convert(Table table, Column column) {
        return synthesizer.synthesize(ctx, table, column, tableElement, constraints);
    }

    private static Element typeOf(Element columnElement) {
        return XmlElements.childElements(columnElement, "type").get(0);
    }

    @Test
    void testAutoIncrementIntegerBecomesIdentity() {
        Column id = column("id", "int").autoIncrement(true).notNull(true).build();
        Table table = Table.builder().id("t-orders").name("orders").nextAutoInc("100").column(id).build();

        Element result = convert(table, id);

        assertThat(result.getAttribute("name")).isEqualTo("id");
        assertThat(result.getAttribute("not-null")).isEqualTo("true");
        assertThat(result.getAttribute("identity-type")).isEqualTo("ALWAYS");
        assertThat(result.getAttribute("start")).isEqualTo("100");
        assertThat(typeOf(result).getAttribute("name")).isEqualTo("integer");
        assertThat(typeOf(result).getAttribute("length")).isEqualTo("0");
        assertThat(ctx.getColumnCount()).isEqualTo(1);
    }

    @Test
    void testIdentityWithoutNextAutoIncHasNoStart() {
        Element result = convert(column("id", "bigint").autoIncrement(true).build());

        assertThat(result.getAttribute("identity-type")).isEqualTo("ALWAYS");
        assertThat(result.hasAttribute("start")).isFalse();
    }

    @Test
    void testBooleanDefaultIsNormalized() {
        Column active = column("active", "tinyint")
                .type(userType("BOOLEAN", "tinyint"))
                .defaultValue("1")
                .build();

        Element result = convert(active);

        assertThat(typeOf(result).getAttribute("name")).isEqualTo("boolean");
        assertThat(result.getAttribute("default-value")).isEqualTo("TRUE");
    }

    @Test
    void testNumericDefaultOnSmallintIsKept() {
        Element result = convert(column("level", "tinyint").defaultValue("0").build());

        assertThat(typeOf(result).getAttribute("name")).isEqualTo("smallint");
        assertThat(result.getAttribute("default-value")).isEqualTo("0");
        assertThat(ctx.getDiagnostics().getWarnings()).isEmpty();
    }

    @Test
    void testQuotedDefaultIsKept() {
        Element result = convert(column("code", "varchar").length(3).defaultValue("'EUR'").build());

        assertThat(result.getAttribute("default-value")).isEqualTo("'EUR'");
        assertThat(ctx.getDiagnostics().getWarnings()).isEmpty();
    }

    @Test
    void testUnknownDefaultIsPassedThroughWithWarning() {
        Element result = convert(column("created", "datetime").defaultValue("NOW()").build());

        assertThat(result.getAttribute("default-value")).isEqualTo("NOW()");
        assertThat(ctx.getDiagnostics().getWarnings()).hasSize(1);
        assertThat(ctx.getDiagnostics().getWarnings().get(0)).contains("NOW()").contains("orders.created");
    }

    @Test
    void testDefaultValueAndNullDefaultIsFatal() {
        Column column = column("qty", "int").defaultValue("5").defaultValueIsNull(true).build();

        assertThatThrownBy(() -> convert(column))
                .isInstanceOf(ConversionException.class)
                .hasMessageContaining("orders.qty")
                .extracting(e -> ((ConversionException) e).getError())
                .isEqualTo(ConversionError.INVALID_DEFAULT_VALUE);
    }

    @Test
    void testNullDefaultOnlyWarns() {
        Element result = convert(column("qty", "int").defaultValueIsNull(true).build());

        assertThat(result.hasAttribute("default-value")).isFalse();
        assertThat(ctx.getDiagnostics().getWarnings()).hasSize(1);
    }

    @Test
    void testOnUpdateTimestampCreatesFunctionAndTrigger() {
        Element result = convert(column("updated_at", "timestamp")
                .defaultValue("CURRENT_TIMESTAMP ON UPDATE CURRENT_TIMESTAMP")
                .build());

        assertThat(result.getAttribute("default-value")).isEqualTo("CURRENT_TIMESTAMP");
        assertThat(typeOf(result).getAttribute("name")).isEqualTo("timestamp with time zone");
        assertThat(typeOf(result).getAttribute("with-timezone")).isEqualTo("true");
        assertThat(ctx.getTimestampFunctions()).containsOnlyKeys("update_updated_at_on_update");
        assertThat(ctx.getTimestampTriggers()).hasSize(1);
        assertThat(ctx.getTimestampTriggers().get(0).getAttribute("name")).isEqualTo("orders_t_update_updated_at");
    }

    @Test
    void testUnsignedPrecisionCreatesSharedDomain() {
        Element first = convert(column("amount", "int").precision(10).flag("UNSIGNED").build());
        Element second = convert(column("balance", "int").precision(10).flag("UNSIGNED").build());

        assertThat(typeOf(first).getAttribute("name")).isEqualTo("public.uinteger10");
        assertThat(typeOf(second).getAttribute("name")).isEqualTo("public.uinteger10");

        List<Element> domains = XmlElements.childElements(ctx.getRoot(), "domain");
        assertThat(domains).hasSize(1);
        Element expression = (Element) domains.get(0).getElementsByTagName("expression").item(0);
        assertThat(expression.getTextContent()).isEqualTo("VALUE >= 0 AND VALUE <= 9999999999");
        assertThat(constraints).isEmpty();
    }

    @Test
    void testSignedPrecisionDomainIsSymmetric() {
        Element result = convert(column("delta", "smallint").precision(4).build());

        assertThat(typeOf(result).getAttribute("name")).isEqualTo("public.smallint4");
        Element domain = XmlElements.childElements(ctx.getRoot(), "domain").get(0);
        assertThat(domain.getAttribute("name")).isEqualTo("smallint4");
        Element constraint = XmlElements.childElements(domain, "constraint").get(0);
        assertThat(constraint.getAttribute("name")).isEqualTo("range4");
        assertThat(constraint.getTextContent()).isEqualTo("VALUE >= -9999 AND VALUE <= 9999");
    }

    @Test
    void testDecimalKeepsPrecisionAndScale() {
        Element type = typeOf(convert(column("total", "decimal").precision(10).scale(2).build()));

        assertThat(type.getAttribute("name")).isEqualTo("decimal");
        assertThat(type.getAttribute("length")).isEqualTo("10");
        assertThat(type.getAttribute("precision")).isEqualTo("2");
    }

    @Test
    void testLengthWithPrecisionIsFatal() {
        Column column = column("code", "varchar").length(5).precision(3).build();

        assertThatThrownBy(() -> convert(column))
                .isInstanceOf(ConversionException.class)
                .extracting(e -> ((ConversionException) e).getError())
                .isEqualTo(ConversionError.INVALID_NUMERIC_SPEC);
    }

    @Test
    void testScaleWithoutPrecisionIsFatal() {
        Column column = column("ratio", "decimal").scale(2).build();

        assertThatThrownBy(() -> convert(column))
                .isInstanceOf(ConversionException.class)
                .hasMessageContaining("orders.ratio");
    }

    @Test
    void testLengthOnForcedLengthTypeIsFatal() {
        Column column = column("body", "text").length(100).build();

        assertThatThrownBy(() -> convert(column))
                .isInstanceOf(ConversionException.class)
                .extracting(e -> ((ConversionException) e).getError())
                .isEqualTo(ConversionError.INVALID_NUMERIC_SPEC);
    }

    @Test
    void testUnsignedIntegerUsesBuiltinDomain() {
        Element result = convert(column("quantity", "int").flag("UNSIGNED").build());

        assertThat(typeOf(result).getAttribute("name")).isEqualTo("public.uinteger");
    }

    @Test
    void testUnsignedIdentityKeepsBaseType() {
        Element result = convert(column("id", "int").autoIncrement(true).flag("UNSIGNED").build());

        assertThat(typeOf(result).getAttribute("name")).isEqualTo("integer");
        assertThat(result.getAttribute("identity-type")).isEqualTo("ALWAYS");
        assertThat(ctx.getDiagnostics().getInfos()).hasSize(1);
        assertThat(ctx.getDiagnostics().getWarnings()).isEmpty();
    }

    @Test
    void testUnsignedNonIntegerAddsCheckConstraint() {
        Element result = convert(column("price", "decimal").precision(8).scale(2).flag("UNSIGNED").build());

        assertThat(typeOf(result).getAttribute("name")).isEqualTo("decimal");
        assertThat(constraints).hasSize(1);
        Element constraint = constraints.get(0);
        assertThat(constraint.getAttribute("name")).isEqualTo("orders_price_ge0");
        assertThat(constraint.getAttribute("type")).isEqualTo("ck-constr");
        assertThat(constraint.getAttribute("table")).isEqualTo("public.orders");
        assertThat(constraint.getTextContent()).isEqualTo("price >= 0");
    }

    @Test
    void testUnsupportedFlagIsIgnoredWithWarning() {
        Element result = convert(column("serial", "int").flag("ZEROFILL").build());

        assertThat(typeOf(result).getAttribute("name")).isEqualTo("integer");
        assertThat(ctx.getDiagnostics().getWarnings()).hasSize(1);
        assertThat(ctx.getDiagnostics().getWarnings().get(0)).contains("ZEROFILL");
    }

    @Test
    void testVarcharBecomesCitextWithLengthCheck() {
        Element type = typeOf(convert(column("name", "varchar").length(100).build()));

        assertThat(type.getAttribute("name")).isEqualTo("citext");
        assertThat(type.hasAttribute("length")).isFalse();
        assertThat(constraints).singleElement().satisfies(c -> {
            assertThat(c.getAttribute("name")).isEqualTo("orders_name_len");
            assertThat(c.getTextContent()).isEqualTo("length(name) <= 100");
        });
    }

    @Test
    void testCharUsesExactLengthCheck() {
        convert(column("country", "char").length(2).build());

        assertThat(constraints).singleElement()
                .satisfies(c -> assertThat(c.getTextContent()).isEqualTo("length(country) = 2"));
    }

    @Test
    void testTextUsesForcedLength() {
        convert(column("note", "text").build());

        assertThat(constraints).singleElement()
                .satisfies(c -> assertThat(c.getTextContent()).isEqualTo("length(note) <= 65535"));
    }

    @Test
    void testCitextDisabledKeepsVarchar() {
        ctx = context(config().citextEnabled(false).build());
        tableElement = ctx.getDocument().createElement("table");

        Element type = typeOf(convert(column("name", "varchar").length(100).build()));

        assertThat(type.getAttribute("name")).isEqualTo("varchar");
        assertThat(type.getAttribute("length")).isEqualTo("100");
        assertThat(constraints).isEmpty();
    }

    @Test
    void testEnumColumnReferencesSynthesizedType() {
        Element result = convert(column("status", "enum").datatypeExplicitParams("('open','shipped')").build());

        assertThat(typeOf(result).getAttribute("name")).isEqualTo("public.enum_status");
        Element userType = XmlElements.childElements(ctx.getRoot(), "usertype").get(0);
        Element enumeration = XmlElements.childElements(userType, "enumeration").get(0);
        assertThat(enumeration.getAttribute("values")).isEqualTo("open,shipped");
    }

    @Test
    void testUnknownTypeFallsBackToSmallint() {
        Element result = convert(column("shape", "geometry").build());

        assertThat(typeOf(result).getAttribute("name")).isEqualTo("smallint");
        assertThat(ctx.getDiagnostics().getWarnings()).hasSize(1);
        assertThat(ctx.getDiagnostics().getWarnings().get(0)).contains("GEOMETRY");
    }

    @Test
    void testCommentIsEmitted() {
        Element result = convert(column("name", "varchar").length(10).comment("Display name").build());

        assertThat(XmlElements.childElements(result, "comment"))
                .singleElement()
                .satisfies(c -> assertThat(c.getTextContent()).isEqualTo("Display name"));
    }
}
