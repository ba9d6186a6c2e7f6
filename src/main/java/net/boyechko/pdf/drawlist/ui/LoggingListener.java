/*
 * PDF-Drawlist - PDF content stream interpretation into draw command lists
 * Copyright (C) 2025 Richard Boyechko
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published
 * by the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package net.boyechko.pdf.drawlist.ui;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.encoder.PatternLayoutEncoder;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.ConsoleAppender;
import net.boyechko.pdf.drawlist.core.PageDrawing;
import net.boyechko.pdf.drawlist.core.RenderListener;
import net.boyechko.pdf.drawlist.core.RenderResult;
import net.boyechko.pdf.drawlist.issue.Issue;
import org.slf4j.LoggerFactory;

/** A {@link RenderListener} that routes all events through SLF4J. */
public class LoggingListener implements RenderListener {

    private static final String CONSOLE_APPENDER_NAME = "DRAWLIST_CONSOLE";

    private static final org.slf4j.Logger logger =
            LoggerFactory.getLogger("net.boyechko.pdf.drawlist.render");

    /** Creates a {@link LoggingListener} and ensures logs are emitted to stdout. */
    public static LoggingListener withConsoleOutput() {
        ensureConsoleAppender();
        return new LoggingListener();
    }

    private static void ensureConsoleAppender() {
        LoggerContext ctx = (LoggerContext) LoggerFactory.getILoggerFactory();
        ch.qos.logback.classic.Logger root = ctx.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);

        if (root.getAppender(CONSOLE_APPENDER_NAME) != null) {
            return;
        }

        PatternLayoutEncoder encoder = new PatternLayoutEncoder();
        encoder.setContext(ctx);
        encoder.setPattern("%-24logger{0} [%-5level] %msg%n");
        encoder.start();

        ConsoleAppender<ILoggingEvent> console = new ConsoleAppender<>();
        console.setName(CONSOLE_APPENDER_NAME);
        console.setContext(ctx);
        console.setEncoder(encoder);
        console.start();

        root.addAppender(console);
    }

    @Override
    public void onDocumentStart(int pageCount) {
        logger.info("DOCUMENT pages={}", pageCount);
    }

    @Override
    public void onPageStart(int pageNum) {
        logger.debug("PAGE {} start", pageNum);
    }

    @Override
    public void onPageRendered(PageDrawing drawing) {
        logger.info(
                "PAGE {} commands={} bitmaps={}",
                drawing.pageNum(),
                drawing.commands().size(),
                drawing.bitmapCount());
    }

    @Override
    public void onIssue(Issue issue) {
        switch (issue.severity()) {
            case INFO -> logger.info("ISSUE {}", issue);
            case WARNING -> logger.warn("ISSUE {}", issue);
            case ERROR -> logger.error("ISSUE {}", issue);
        }
    }

    @Override
    public void onError(String message) {
        logger.error("{}", message);
    }

    @Override
    public void onInfo(String message) {
        logger.info("{}", message);
    }

    @Override
    public void onSummary(RenderResult result) {
        logger.info(
                "SUMMARY pages={} commands={} bitmaps={} issues={} missingFonts={}",
                result.pages().size(),
                result.totalCommands(),
                result.totalBitmaps(),
                result.issues().size(),
                result.missingFonts().size());
    }
}
