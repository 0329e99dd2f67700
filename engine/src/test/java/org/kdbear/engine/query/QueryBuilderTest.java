package org.kdbear.engine.query;

import org.kdbear.engine.metadata.ColumnMeta;
import org.kdbear.engine.types.TypeRegistry;
import org.kdbear.engine.wire.KType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("QueryBuilder Tests")
class QueryBuilderTest {

    private static final List<ColumnMeta> TRADES = List.of(
            new ColumnMeta("ticker", 's', KType.SYMBOL),
            new ColumnMeta("price", 'j', KType.LONG),
            new ColumnMeta("size", 'j', KType.LONG));

    private final QueryBuilder builder = new QueryBuilder(TypeRegistry.standard());

    private String where(String condition) {
        return builder.renderCondition(ConditionParser.parse(condition), TRADES);
    }

    // ==================== iloc ====================

    @Nested
    @DisplayName("iloc")
    class IlocTests {

        @Test
        @DisplayName("Index lists in requested order")
        void testIndices() {
            assertEquals("(0!trades)[(2;0);(cols trades)[(1;0)]]",
                    builder.iloc("trades", List.of(2, 0), List.of(1, 0)));
        }

        @Test
        @DisplayName("A single index renders in parentheses")
        void testSingleIndex() {
            assertEquals("(0)", QueryBuilder.indexList(List.of(0)));
            assertEquals("(0!t)[(1);(cols t)[(2)]]", builder.iloc("t", List.of(1), List.of(2)));
        }

        @Test
        @DisplayName("Empty lists select everything")
        void testEmpty() {
            assertEquals("(0!t)[til count t;(cols t)[til count cols t]]",
                    builder.iloc("t", List.of(), List.of()));
        }
    }

    // ==================== loc ====================

    @Nested
    @DisplayName("loc")
    class LocTests {

        @Test
        @DisplayName("No conditions selects the unkeyed table")
        void testNoConditions() {
            assertEquals("(0!trades)", builder.loc("trades", List.of(), TRADES));
        }

        @Test
        @DisplayName("Each condition wraps the previous selection")
        void testNesting() {
            String query = builder.loc("trades", ConditionParser.parseAll("price > 25, size < 30"), TRADES);

            assertEquals("(0!select from ((0!select from (trades) where price > 25)) where size < 30)", query);
        }

        @ParameterizedTest
        @CsvSource(delimiter = '|', value = {
                "price > 25     | price > 25",
                "price >= 25    | price >= 25",
                "price == 25    | price = 25",
                "price != 25    | price <> 25",
                "price ~ size   | price ~ size",
                "price <= -2.5  | price <= -2.5"
        })
        void testOperatorMapping(String condition, String expected) {
            assertEquals(expected, where(condition));
        }

        @Test
        @DisplayName("Symbol columns compare against symbol literals")
        void testSymbolQuoting() {
            assertEquals("ticker = `AAPL", where("ticker = AAPL"));
            assertEquals("ticker = `AAPL", where("ticker = 'AAPL'"));
            assertEquals("ticker = `$\"BRK B\"", where("ticker = \"BRK B\""));
        }

        @Test
        @DisplayName("like on a symbol column keeps its string pattern")
        void testSymbolLike() {
            assertEquals("ticker like \"A*\"", where("ticker like \"A*\""));
            assertEquals("(0!select from (trades) where ticker like \"A*\")",
                    builder.loc("trades", ConditionParser.parseAll("ticker like 'A*'"), TRADES));
        }

        @Test
        @DisplayName("Non-symbol columns keep identifiers as column references")
        void testNonSymbolColumn() {
            assertEquals("price = size", where("price = size"));
        }

        @Test
        @DisplayName("like takes a string pattern; one-character strings stay strings")
        void testStrings() {
            assertEquals("name like \"G*\"", builder.renderCondition(ConditionParser.parse("name like 'G*'"), TRADES));
            assertEquals("name like (enlist \"G\")", builder.renderCondition(ConditionParser.parse("name like \"G\""), TRADES));
        }

        @Test
        @DisplayName("Arithmetic is parenthesized and mapped to q operators")
        void testArithmetic() {
            assertEquals("((price * 2) + 1) > size", where("price * 2 + 1 > size"));
            assertEquals("(price % 2) = (size mod 3)", where("price / 2 = size % 3"));
            assertEquals("(price - (size - 1)) > 0", where("price - (size - 1) > 0"));
        }

        @Test
        @DisplayName("Function calls render with brackets")
        void testFunctionCall() {
            assertEquals("within[price;10] = 1", where("within(price; 10) = 1"));
            assertEquals("max[size] > 20", where("max(size) > 20"));
        }
    }
}
