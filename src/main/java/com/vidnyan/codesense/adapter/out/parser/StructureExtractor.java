package com.vidnyan.codesense.adapter.out.parser;

import com.vidnyan.codesense.domain.model.ParseResult;
import com.vidnyan.codesense.domain.model.SourceLanguage;

/**
 * Structural extractor for one family of languages.
 * Syntax problems are reported in the result, never thrown.
 */
interface StructureExtractor {

    ParseResult extract(String code, SourceLanguage language);
}
