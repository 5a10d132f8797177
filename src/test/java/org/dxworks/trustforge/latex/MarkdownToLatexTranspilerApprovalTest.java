package org.dxworks.trustforge.latex;

import org.approvaltests.Approvals;
import org.dxworks.trustforge.markdown.FrontMatterParser;
import org.dxworks.trustforge.model.ParsedPolicy;
import org.junit.jupiter.api.Test;

import java.nio.file.Paths;

public class MarkdownToLatexTranspilerApprovalTest {

    @Test
    void transpile_SamplePolicy() throws Exception {
        ParsedPolicy policy = FrontMatterParser.read(Paths.get("src/test/resources/samples/policies/access-control.md"));
        Approvals.verify(MarkdownToLatexTranspiler.transpile(policy.body()));
    }
}
