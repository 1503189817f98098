package org.dxworks.lintframe.syntax;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Static helpers over the tree-sitter-php node vocabulary. Older and newer grammar names for the
 * same construct are both accepted.
 */
public final class PhpNodes {

    public static final String[] METHOD_CALLS = {"member_call_expression", "nullsafe_member_call_expression"};
    public static final String[] CALLS = {
            "member_call_expression", "nullsafe_member_call_expression",
            "scoped_call_expression", "function_call_expression"
    };
    public static final String[] PROPERTY_ACCESS = {"member_access_expression", "nullsafe_member_access_expression"};
    public static final String[] CLOSURES = {"anonymous_function", "anonymous_function_creation_expression", "arrow_function"};
    public static final String[] LOOPS = {"foreach_statement", "for_statement", "while_statement", "do_statement"};
    public static final String[] FUNCTIONS = {"method_declaration", "function_definition"};
    public static final String[] CLASS_LIKE = {"class_declaration", "trait_declaration", "interface_declaration", "enum_declaration"};
    public static final String[] STRINGS = {"string", "encapsed_string"};

    private PhpNodes() {
    }

    public static boolean isCall(SyntaxNode node) {
        return node != null && node.is(CALLS);
    }

    public static boolean isMethodCall(SyntaxNode node) {
        return node != null && node.is(METHOD_CALLS);
    }

    public static boolean isStaticCall(SyntaxNode node) {
        return node != null && node.is("scoped_call_expression");
    }

    public static boolean isFunctionCall(SyntaxNode node) {
        return node != null && node.is("function_call_expression");
    }

    public static boolean isPropertyAccess(SyntaxNode node) {
        return node != null && node.is(PROPERTY_ACCESS);
    }

    public static boolean isClosure(SyntaxNode node) {
        return node != null && node.is(CLOSURES);
    }

    public static boolean isLoop(SyntaxNode node) {
        return node != null && node.is(LOOPS);
    }

    /** Method or function name of a call, or null when the name is dynamic. */
    public static String callName(SyntaxNode call) {
        if (call == null) return null;
        if (call.is("function_call_expression")) {
            SyntaxNode fn = call.child("function");
            if (fn == null) fn = call.child(0);
            if (fn != null && fn.is("name", "qualified_name")) {
                return stripLeadingBackslash(fn.text());
            }
            return null;
        }
        if (call.is(CALLS)) {
            SyntaxNode name = call.child("name");
            if (name != null && name.is("name")) return name.text();
        }
        return null;
    }

    /** Object of a method call or scope of a static call. */
    public static SyntaxNode receiver(SyntaxNode call) {
        if (call == null) return null;
        if (call.is("scoped_call_expression")) {
            SyntaxNode scope = call.child("scope");
            return scope != null ? scope : call.child(0);
        }
        if (call.is(METHOD_CALLS) || call.is(PROPERTY_ACCESS)) {
            SyntaxNode object = call.child("object");
            return object != null ? object : call.child(0);
        }
        return null;
    }

    /** Class named in a static call ({@code self}, {@code static} and {@code parent} included). */
    public static String scopeName(SyntaxNode staticCall) {
        SyntaxNode scope = receiver(staticCall);
        if (scope != null && scope.is("name", "qualified_name", "relative_scope")) {
            return stripLeadingBackslash(scope.text());
        }
        return null;
    }

    public static List<SyntaxNode> arguments(SyntaxNode call) {
        if (call == null) return Collections.emptyList();
        SyntaxNode args = call.child("arguments");
        if (args == null) args = call.firstChild("arguments");
        if (args == null) return Collections.emptyList();
        List<SyntaxNode> values = new ArrayList<>();
        for (SyntaxNode arg : args.children()) {
            SyntaxNode value = argumentValue(arg);
            if (value != null) values.add(value);
        }
        return values;
    }

    public static SyntaxNode argument(SyntaxNode call, int index) {
        List<SyntaxNode> args = arguments(call);
        return index < args.size() ? args.get(index) : null;
    }

    static SyntaxNode argumentValue(SyntaxNode argument) {
        if (!argument.is("argument")) return argument;
        for (int i = argument.childCount() - 1; i >= 0; i--) {
            SyntaxNode c = argument.child(i);
            if (!"name".equals(c.field())) return c;
        }
        return null;
    }

    public static boolean isStringLiteral(SyntaxNode node) {
        return stringValue(node) != null;
    }

    /** Value of a string literal without interpolation, or null. */
    public static String stringValue(SyntaxNode node) {
        if (node == null) return null;
        if (node.is("string")) {
            return unquote(node.text());
        }
        if (node.is("encapsed_string")) {
            for (SyntaxNode part : node.children()) {
                if (!part.is("string_content", "string_value", "escape_sequence")) return null;
            }
            return unquote(node.text());
        }
        return null;
    }

    /** True for double-quoted strings and heredocs that embed variables or expressions. */
    public static boolean isInterpolated(SyntaxNode node) {
        if (node == null || !node.is("encapsed_string", "heredoc")) return false;
        for (SyntaxNode part : node.findAll("variable_name", "member_access_expression", "subscript_expression")) {
            if (part != node) return true;
        }
        return false;
    }

    private static String unquote(String text) {
        String t = text;
        if (t.length() >= 2 && (t.startsWith("'") || t.startsWith("\""))) {
            t = t.substring(1, t.length() - 1);
        }
        return t.replace("\\'", "'").replace("\\\"", "\"").replace("\\\\", "\\");
    }

    /** Variable name without the dollar sign, or null when the node is not a plain variable. */
    public static String variableName(SyntaxNode node) {
        if (node == null || !node.is("variable_name")) return null;
        String text = node.text();
        return text.startsWith("$") ? text.substring(1) : text;
    }

    public static boolean isThis(SyntaxNode node) {
        return "this".equals(variableName(node));
    }

    /**
     * True when the call is not itself the receiver of a further call or property access,
     * i.e. it is the outermost link of its chain.
     */
    public static boolean isChainTop(SyntaxNode call) {
        SyntaxNode parent = call.parent();
        if (parent == null) return true;
        if (parent.is(METHOD_CALLS) || parent.is(PROPERTY_ACCESS)) {
            return receiver(parent) != call;
        }
        return true;
    }

    public static MethodChain chain(SyntaxNode call) {
        List<MethodChain.Link> links = new ArrayList<>();
        SyntaxNode current = call;
        while (current != null) {
            if (current.is(METHOD_CALLS)) {
                links.add(0, new MethodChain.Link(callName(current), current, false));
                current = receiver(current);
            } else if (current.is("scoped_call_expression")) {
                links.add(0, new MethodChain.Link(callName(current), current, true));
                current = receiver(current);
                break;
            } else if (current.is("parenthesized_expression") && current.childCount() == 1) {
                current = current.child(0);
            } else {
                break;
            }
        }
        return new MethodChain(current, links);
    }

    /**
     * Property names read off a variable, outermost last: {@code $post->author->team} gives
     * {@code [author, team]} with root variable {@code post}. Returns an empty list when the
     * expression is not a plain property chain.
     */
    public static List<String> propertyPath(SyntaxNode access) {
        List<String> segments = new ArrayList<>();
        SyntaxNode current = access;
        while (current != null && current.is(PROPERTY_ACCESS)) {
            SyntaxNode name = current.child("name");
            if (name == null || !name.is("name")) return Collections.emptyList();
            segments.add(0, name.text());
            current = receiver(current);
        }
        if (variableName(current) == null) return Collections.emptyList();
        return segments;
    }

    /** Innermost receiver of a property chain. */
    public static SyntaxNode propertyRoot(SyntaxNode access) {
        SyntaxNode current = access;
        while (current != null && current.is(PROPERTY_ACCESS)) {
            current = receiver(current);
        }
        return current;
    }

    public static String declarationName(SyntaxNode declaration) {
        if (declaration == null) return null;
        SyntaxNode name = declaration.child("name");
        return name != null ? name.text() : null;
    }

    public static SyntaxNode body(SyntaxNode node) {
        if (node == null) return null;
        SyntaxNode body = node.child("body");
        if (body != null) return body;
        if (node.is("foreach_statement", "for_statement", "while_statement")) return node.lastChild();
        if (node.is("do_statement")) return node.child(0);
        return node.firstChild("compound_statement", "declaration_list");
    }

    /** Name written in the {@code extends} clause, leading backslash kept, or null. */
    public static String baseClassName(SyntaxNode classNode) {
        SyntaxNode base = classNode.firstChild("base_clause");
        if (base == null) return null;
        SyntaxNode name = base.firstChild("name", "qualified_name");
        return name != null ? name.text() : null;
    }

    /** Class named by {@code new X(...)}, or null for anonymous and dynamic instantiation. */
    public static String instantiatedClass(SyntaxNode creation) {
        if (creation == null || !creation.is("object_creation_expression")) return null;
        SyntaxNode name = creation.firstChild("name", "qualified_name");
        return name != null ? stripLeadingBackslash(name.text()) : null;
    }

    public static boolean isAnonymousClass(SyntaxNode node) {
        if (node == null) return false;
        if (node.is("anonymous_class")) return true;
        return node.is("object_creation_expression") && node.firstChild("declaration_list") != null;
    }

    /** Exception types named in a catch clause. */
    public static List<String> catchTypes(SyntaxNode catchClause) {
        List<String> types = new ArrayList<>();
        SyntaxNode type = catchClause.child("type");
        if (type == null) type = catchClause.firstChild("type_list", "named_type", "name", "qualified_name");
        if (type == null) return types;
        for (SyntaxNode n : type.findAll("name", "qualified_name")) {
            if (n.parent() != null && n.parent().is("qualified_name", "namespace_name")) continue;
            types.add(stripLeadingBackslash(n.text()));
        }
        return types;
    }

    /** Keys (string literals) and values of an array literal; keys are null for list entries. */
    public static List<SyntaxNode[]> arrayEntries(SyntaxNode array) {
        List<SyntaxNode[]> entries = new ArrayList<>();
        if (array == null || !array.is("array_creation_expression")) return entries;
        for (SyntaxNode element : array.childrenOfKind("array_element_initializer")) {
            if (element.childCount() >= 2 && "=>".equals(element.token())) {
                entries.add(new SyntaxNode[]{element.child(0), element.child(1)});
            } else if (element.childCount() >= 1) {
                entries.add(new SyntaxNode[]{null, element.child(0)});
            }
        }
        return entries;
    }

    /** True when {@code node} sits inside a closure that is itself nested below {@code boundary}. */
    public static boolean isInsideClosure(SyntaxNode node, SyntaxNode boundary) {
        SyntaxNode current = node.parent();
        while (current != null && current != boundary) {
            if (current.is(CLOSURES)) return true;
            current = current.parent();
        }
        return false;
    }

    /** Nearest enclosing class-like declaration or anonymous class, or null. */
    public static SyntaxNode enclosingClass(SyntaxNode node) {
        SyntaxNode current = node.parent();
        while (current != null) {
            if (current.is(CLASS_LIKE) || isAnonymousClass(current)) return current;
            current = current.parent();
        }
        return null;
    }

    public static String stripLeadingBackslash(String name) {
        if (name == null) return null;
        return name.startsWith("\\") ? name.substring(1) : name;
    }

    public static String shortName(String qualifiedName) {
        if (qualifiedName == null) return null;
        int idx = qualifiedName.lastIndexOf('\\');
        return idx >= 0 ? qualifiedName.substring(idx + 1) : qualifiedName;
    }
}
