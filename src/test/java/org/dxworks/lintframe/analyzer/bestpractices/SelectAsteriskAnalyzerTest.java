package org.dxworks.lintframe.analyzer.bestpractices;

import org.dxworks.lintframe.analyzer.AnalyzerOptions;
import org.dxworks.lintframe.model.Issue;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.dxworks.lintframe.TestUtils.*;
import static org.junit.jupiter.api.Assertions.*;

class SelectAsteriskAnalyzerTest {

    @Test
    void queriesWithoutColumnSelectionAreReported() {
        SelectAsteriskAnalyzer analyzer = new SelectAsteriskAnalyzer(AnalyzerOptions.empty(SelectAsteriskAnalyzer.ID));
        String source = "<?php\n"
                + "$a = User::all();\n"
                + "$b = User::where('active', 1)->get();\n"
                + "$c = User::select('id', 'name')->get();\n"
                + "$d = User::find(1, ['id']);\n"
                + "$e = DB::table('users')->first();\n"
                + "$f = $query->where('x', 1)->get();\n"
                + "$g = collect($rows)->first();\n"
                + "$h = $request->get('name');\n"
                + "$i = Cache::get('key');\n";

        List<Issue> issues = analyze(analyzer, "app/Services/UserService.php", source);

        assertEquals(List.of(2, 3, 6, 7), lines(issues));
        assertEquals("Query using ->all() without ->select() fetches all columns", issues.get(0).message);
        assertEquals("first", issues.get(2).metadata.get("method"));
    }
}
