package com.vidnyan.depindex.application.render;

import com.vidnyan.depindex.application.port.in.DependencyQueryUseCase.DependencyReport;
import com.vidnyan.depindex.application.port.in.DependencyQueryUseCase.GraphQueryResult;

/**
 * Renders query results in one output format.
 */
public interface ReportRenderer {

    OutputFormat format();

    String render(DependencyReport report);

    String render(GraphQueryResult<?> result);
}
