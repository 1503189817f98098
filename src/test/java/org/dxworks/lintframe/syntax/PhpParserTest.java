package org.dxworks.lintframe.syntax;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PhpParserTest {

    private final PhpParser parser = new PhpParser();

    @Test
    void parsesClassDeclarationWithParent() throws ParseException {
        SyntaxTree tree = parser.parse("<?php\nclass Invoice extends Document\n{\n    public function total() { return $a + 1; }\n}\n");

        List<SyntaxNode> classes = tree.root().findAll("class_declaration");
        assertEquals(1, classes.size());
        SyntaxNode cls = classes.get(0);
        assertEquals("Invoice", PhpNodes.declarationName(cls));
        assertEquals("Document", PhpNodes.baseClassName(cls));
        assertEquals(2, cls.startLine());
        assertEquals(5, cls.endLine());

        SyntaxNode method = cls.findFirst("method_declaration");
        assertEquals("total", PhpNodes.declarationName(method));
        assertSame(cls, PhpNodes.enclosingClass(method));

        SyntaxNode sum = tree.root().findFirst("binary_expression");
        assertEquals("+", sum.token());
        assertEquals(4, sum.startLine());
    }

    @Test
    void invalidSyntaxIsAParseException() {
        ParseException e = assertThrows(ParseException.class,
                () -> parser.parse("<?php\n\nfunction broken( {\n    return 1;\n"));
        assertTrue(e.getLine() >= 1);
        assertTrue(e.getMessage().startsWith("Syntax error near line"));
    }

    @Test
    void commentsAreKeptOutOfTheNodeTree() throws ParseException {
        SyntaxTree tree = parser.parse("<?php\n// first\n$a = 1; /* second */\n");

        assertEquals(2, tree.comments().size());
        assertEquals("// first", tree.comments().get(0).text());
        assertEquals(2, tree.comments().get(0).startLine());
        assertTrue(tree.root().findAll("comment").isEmpty());
    }

    @Test
    void byteOrderMarkIsIgnored() throws ParseException {
        SyntaxTree tree = parser.parse("\uFEFF<?php\n$a = 'x';\n");

        SyntaxNode assignment = tree.root().findFirst("assignment_expression");
        assertNotNull(assignment);
        assertEquals(2, assignment.startLine());
    }

    @Test
    void multibyteTextIsDecodedFromByteOffsets() throws ParseException {
        SyntaxTree tree = parser.parse("<?php\n$greeting = 'héllo wörld';\n$next = \"ok\";\n");

        List<SyntaxNode> assignments = tree.root().findAll("assignment_expression");
        assertEquals("héllo wörld", PhpNodes.stringValue(assignments.get(0).child("right")));
        assertEquals("ok", PhpNodes.stringValue(assignments.get(1).child("right")));
        assertEquals("next", PhpNodes.variableName(assignments.get(1).child("left")));
    }

    @Test
    void fieldNamesAreRecorded() throws ParseException {
        SyntaxTree tree = parser.parse("<?php\n$user->posts()->where('active', 1)->get();\n");

        SyntaxNode top = tree.root().findFirst(PhpNodes.METHOD_CALLS);
        assertEquals("get", PhpNodes.callName(top));
        assertEquals("object", PhpNodes.receiver(top).field());
        assertTrue(PhpNodes.isChainTop(top));
    }
}
