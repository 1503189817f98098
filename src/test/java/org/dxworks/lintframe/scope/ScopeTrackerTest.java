package org.dxworks.lintframe.scope;

import org.dxworks.lintframe.registry.ModelRegistry;
import org.dxworks.lintframe.syntax.PhpNodes;
import org.dxworks.lintframe.syntax.SyntaxNode;
import org.dxworks.lintframe.syntax.SyntaxTree;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.dxworks.lintframe.TestUtils.parse;
import static org.dxworks.lintframe.TestUtils.registry;
import static org.junit.jupiter.api.Assertions.*;

class ScopeTrackerTest {

    /** Records what the tracker reports at every static call. */
    private static class Recorder implements NodeVisitor {
        final List<String> seen = new ArrayList<>();
        int maxDepth;

        @Override
        public void enterNode(SyntaxNode node, ScopeTracker scope) {
            maxDepth = Math.max(maxDepth, scope.depth());
            if (!PhpNodes.isStaticCall(node)) return;
            seen.add(scope.resolveClassName(PhpNodes.scopeName(node))
                    + "|" + scope.currentClassFqcn()
                    + "|" + scope.currentMethodName()
                    + "|" + scope.insideClosure());
        }
    }

    @Test
    void resolvesImportsAndTracksClassAndMethod() {
        SyntaxTree tree = parse("<?php\nnamespace App\\Http\\Controllers;\n\nuse App\\Models\\User;\nuse App\\Models\\Post as Article;\n\n"
                + "class UserController\n{\n    public function index()\n    {\n        User::all();\n        Article::find(1);\n"
                + "        Comment::first();\n        $cb = function () { User::count(); };\n    }\n}\n");
        Recorder recorder = new Recorder();

        ScopeTracker tracker = new TreeWalker(ModelRegistry.empty()).walk(tree, recorder);

        assertEquals(List.of(
                "App\\Models\\User|App\\Http\\Controllers\\UserController|index|false",
                "App\\Models\\Post|App\\Http\\Controllers\\UserController|index|false",
                "App\\Http\\Controllers\\Comment|App\\Http\\Controllers\\UserController|index|false",
                "App\\Models\\User|App\\Http\\Controllers\\UserController|index|true"), recorder.seen);
        assertEquals(1, tracker.depth(), "only the file frame is left after a walk");
        assertTrue(recorder.maxDepth >= 4);
    }

    @Test
    void bindingsDoNotLeakBetweenMethodsOrIntoClosures() {
        SyntaxTree tree = parse("<?php\nclass Service\n{\n    public function a()\n    {\n        $user = 1;\n"
                + "        $f = function () use ($user) { return $user; };\n    }\n\n    public function b()\n    {\n        return $user;\n    }\n}\n");
        List<String> observations = new ArrayList<>();

        new TreeWalker(ModelRegistry.empty()).walk(tree, new NodeVisitor() {
            @Override
            public void enterNode(SyntaxNode node, ScopeTracker scope) {
                if (node.is("assignment_expression") && "user".equals(PhpNodes.variableName(node.child("left")))) {
                    scope.bind("user", Provenance.modelClass("App\\Models\\User"));
                }
                if (node.is("return_statement")) {
                    observations.add(scope.currentMethodName() + ":" + scope.lookup("user").kind());
                }
            }
        });

        assertEquals(List.of("a:UNKNOWN", "b:UNKNOWN"), observations);
    }

    @Test
    void selfAndParentResolveAgainstTheClassChain() {
        ModelRegistry models = registry(
                "<?php\nnamespace App\\Models;\nuse Illuminate\\Database\\Eloquent\\Model;\nclass Base extends Model {}\n");
        SyntaxTree tree = parse("<?php\nnamespace App\\Models;\n\nclass Invoice extends Base\n{\n    public function f()\n    {\n"
                + "        self::query();\n        parent::boot();\n    }\n}\n");
        Recorder recorder = new Recorder();
        List<List<String>> chains = new ArrayList<>();

        new TreeWalker(models).walk(tree, recorder, new NodeVisitor() {
            @Override
            public void enterNode(SyntaxNode node, ScopeTracker scope) {
                if (node.is("method_declaration")) chains.add(scope.currentClassChain());
            }
        });

        assertEquals("App\\Models\\Invoice", recorder.seen.get(0).split("\\|")[0]);
        assertEquals("App\\Models\\Base", recorder.seen.get(1).split("\\|")[0]);
        assertEquals(List.of(List.of("App\\Models\\Base", "Illuminate\\Database\\Eloquent\\Model")), chains);
    }

    @Test
    void anonymousClassHasNoName() {
        SyntaxTree tree = parse("<?php\n$x = new class {\n    public function run() { Foo::bar(); }\n};\n");
        Recorder recorder = new Recorder();

        new TreeWalker(ModelRegistry.empty()).walk(tree, recorder);

        assertEquals(List.of("Foo|null|run|false"), recorder.seen);
    }
}
