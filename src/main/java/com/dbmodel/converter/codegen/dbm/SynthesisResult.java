package com.dbmodel.converter.codegen.dbm;

import com.dbmodel.converter.codegen.context.ConversionDiagnostics;
import com.dbmodel.converter.codegen.context.SynthesisStats;
import lombok.Value;
import org.w3c.dom.Document;

@Value
public class SynthesisResult {
    Document document;
    SynthesisStats stats;
    ConversionDiagnostics diagnostics;
}
