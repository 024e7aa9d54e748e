/*
 * Copyright 2026 Babak Farhang
 */
package io.crums.audit.cli.audl;


import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;
import java.util.concurrent.Callable;

import io.crums.audit.config.AuditConfig;
import io.crums.audit.config.AuditSystem;
import io.crums.audit.custody.CustodyExportFormat;
import io.crums.audit.ledger.ExportFormat;
import io.crums.audit.ledger.Result;
import io.crums.audit.ledger.VerificationReport;
import io.crums.audit.session.Finding;
import io.crums.audit.trail.AuditStatistics;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Help.Ansi;
import picocli.CommandLine.HelpCommand;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;
import picocli.CommandLine.Spec;

/**
 * Audit ledger command line tool.
 */
@Command(
    name = "audl",
    mixinStandardHelpOptions = true,
    version = "audl 0.1",
    synopsisHeading = "",
    customSynopsis = {
        "Audit trail and chain-of-custody inspection tool.",
        "",
        "Every recorded action lives in a hash-linked ledger: each entry's hash commits",
        "to its payload and to its predecessor's hash, so that any modification, removal",
        "or reordering of past entries is detected on verification.",
        "",
        "@|bold Usage:|@",
        "",
        "  @|bold audl|@ @|fg(yellow) CONFIG|@ COMMAND",
        "  @|bold audl help|@ COMMAND",
        "  @|bold audl|@ [@|fg(yellow) -hV|@]",
        "",
        },
    subcommands = {
        HelpCommand.class,
        Verify.class,
        Export.class,
        Stats.class,
        Custody.class,
        Suspicious.class,
    })
public class Audl {

  /** Exit code on verification failure. */
  final static int FAIL = 1;
  /** Exit code on error. */
  final static int ERROR = 2;


  public static void main(String[] args) {
    int exitCode = newCommandLine().execute(args);
    System.exit(exitCode);
  }


  /**
   * Returns a new command line whose errors print as one-liners.
   */
  public static CommandLine newCommandLine() {
    return new CommandLine(new Audl()).setExecutionExceptionHandler(
        (ex, commandLine, parseResult) -> {
          commandLine.getErr().println(
              Ansi.AUTO.string("[@|fg(red),bold ERROR|@]: " + ex.getMessage()));
          return ERROR;
        });
  }



  @Spec
  private CommandSpec spec;

  private File configFile;


  @Parameters(
      arity = "1",
      paramLabel = "CONFIG",
      description = {
          "Audit properties file (@|fg(yellow) audit.dir|@ required)",
      })
  public void setConfigFile(File configFile) {
    this.configFile = configFile;
    if (!configFile.isFile())
      throw new ParameterException(spec.commandLine(), "not a file: " + configFile);
  }


  public File getConfigFile() {
    return configFile;
  }


  AuditSystem openSystem() {
    return AuditSystem.open(new AuditConfig(configFile));
  }


  static void printReport(String name, VerificationReport report, PrintWriter out) {
    if (report.valid()) {
      out.println(Ansi.AUTO.string(
          "[@|fg(green),bold VALID|@]: " + name + " (" + nOf(report.totalEntries(), "entry", "entries") + ")"));
      return;
    }
    out.println(Ansi.AUTO.string(
        "[@|fg(red),bold TAMPERED|@]: " + name + " (" +
        report.verifiedEntries() + " of " + nOf(report.totalEntries(), "entry", "entries") +
        " verified)"));
    for (var diagnostic : report.tamperedEntries())
      out.println("  " + diagnostic);
    for (var diagnostic : report.brokenLinks())
      out.println("  " + diagnostic);
  }


  static String nOf(long count, String single, String plural) {
    return count + " " + (count == 1 ? single : plural);
  }


  static <T> T getOrFail(Result<T> result, CommandSpec spec) {
    if (!result.hasValue())
      throw new ParameterException(spec.commandLine(), result.message());
    return result.get();
  }

}



@Command(
    name = Verify.NAME,
    description = {
        "Verifies the audit trail and every chain of custody",
        "Exits with code 1 if any ledger fails verification (or can't be read).",
        "",
    })
class Verify implements Callable<Integer> {

  final static String NAME = "verify";

  @ParentCommand
  private Audl audl;

  @Spec
  private CommandSpec spec;

  @Option(
      names = { "-d", "--doc" },
      paramLabel = "DOC_ID",
      description = "Verify only the given document's chain of custody")
  private Long documentId;


  @Override
  public Integer call() {
    var out = spec.commandLine().getOut();
    boolean ok = true;
    try (var system = audl.openSystem()) {
      var custody = system.custody();
      if (documentId == null) {
        var report = system.auditTrail().verify();
        Audl.printReport("audit trail", report, out);
        ok = report.valid();

        for (var e : custody.unreadableDocuments().entrySet()) {
          ok = false;
          out.println(Ansi.AUTO.string(
              "[@|fg(red),bold UNREADABLE|@]: custody " + e.getKey() + ": " + e.getValue()));
        }
      }
      List<Long> ids = documentId == null ? custody.documentIds() : List.of(documentId);
      for (var id : ids) {
        var verification = Audl.getOrFail(custody.verify(id), spec);
        Audl.printReport("custody " + id, verification.report(), out);
        for (var issue : verification.issues())
          out.println(Ansi.AUTO.string("  @|fg(yellow) ISSUE|@ " + issue));
        ok &= verification.valid();
      }
    }
    out.flush();
    return ok ? 0 : Audl.FAIL;
  }

}


@Command(
    name = Export.NAME,
    description = {
        "Exports the audit trail, or a document's chain of custody",
        "Formats: json, csv (and, for custody, text)",
        "",
    })
class Export implements Callable<Integer> {

  final static String NAME = "export";

  @ParentCommand
  private Audl audl;

  @Spec
  private CommandSpec spec;

  @Option(
      names = { "-f", "--format" },
      paramLabel = "FORMAT",
      description = "Export format (default: json)")
  private String format = "json";

  @Option(
      names = { "-d", "--doc" },
      paramLabel = "DOC_ID",
      description = "Export the given document's chain of custody instead")
  private Long documentId;

  @Option(
      names = { "-o", "--out" },
      paramLabel = "FILE",
      description = "Output file (default: standard out)")
  private File outFile;


  @Override
  public Integer call() throws IOException {
    byte[] bytes;
    try (var system = audl.openSystem()) {
      Result<byte[]> result;
      if (documentId == null) {
        if (ExportFormat.forName(format).isEmpty())
          throw new ParameterException(spec.commandLine(), "unsupported format: " + format);
        result = system.auditTrail().export(format);
      } else {
        if (CustodyExportFormat.forName(format).isEmpty())
          throw new ParameterException(spec.commandLine(), "unsupported format: " + format);
        result = system.custody().export(documentId, format);
      }
      bytes = Audl.getOrFail(result, spec);
    }
    if (outFile == null) {
      var out = spec.commandLine().getOut();
      out.print(new String(bytes, StandardCharsets.UTF_8));
      out.flush();
    } else {
      Files.write(outFile.toPath(), bytes);
      spec.commandLine().getErr().println(
          Audl.nOf(bytes.length, "byte", "bytes") + " written to " + outFile);
    }
    return 0;
  }

}


@Command(
    name = Stats.NAME,
    description = {
        "Prints audit trail statistics",
        "",
    })
class Stats implements Runnable {

  final static String NAME = "stats";

  @ParentCommand
  private Audl audl;

  @Spec
  private CommandSpec spec;


  @Override
  public void run() {
    var out = spec.commandLine().getOut();
    AuditStatistics stats;
    try (var system = audl.openSystem()) {
      stats = system.auditTrail().statistics();
    }
    out.println(Ansi.AUTO.string("[@|fg(blue),bold STATS|@]:"));
    out.println("  entries:   " + stats.totalEntries());
    out.println("  earliest:  " + stats.earliestTime().map(Object::toString).orElse("-"));
    out.println("  latest:    " + stats.latestTime().map(Object::toString).orElse("-"));
    out.println("  users:     " + stats.uniqueUsers());
    out.println("  documents: " + stats.documentsAccessed());
    printCounts("top actions", stats.topActions(), out);
    printCounts("top users", stats.topUsers(), out);
    if (stats.persistenceFailures() > 0)
      out.println(Ansi.AUTO.string(
          "[@|fg(yellow),bold WARNING|@]: " +
          Audl.nOf(stats.persistenceFailures(), "write failure", "write failures") +
          "; last: " + stats.lastPersistenceError()));
    out.flush();
  }


  private void printCounts(String title, List<AuditStatistics.Count> counts, PrintWriter out) {
    if (counts.isEmpty())
      return;
    out.println("  " + title + ":");
    for (var count : counts)
      out.println("    " + count.name() + ": " + count.count());
  }

}


@Command(
    name = Custody.NAME,
    description = {
        "Prints a summary of a document's chain of custody",
        "",
    })
class Custody implements Runnable {

  final static String NAME = "custody";

  @ParentCommand
  private Audl audl;

  @Spec
  private CommandSpec spec;

  @Parameters(
      arity = "1",
      paramLabel = "DOC_ID",
      description = "Document id")
  private long documentId;


  @Override
  public void run() {
    var out = spec.commandLine().getOut();
    try (var system = audl.openSystem()) {
      var summary = Audl.getOrFail(system.custody().summary(documentId), spec);
      out.println(Ansi.AUTO.string("[@|fg(blue),bold CUSTODY|@]: document " + documentId));
      out.println("  entries:    " + summary.totalEntries());
      out.println("  first:      " + summary.start() + " (" + summary.first().action() + ")");
      out.println("  last:       " + summary.end() + " (" + summary.last().action() + ")");
      out.println("  span:       " + summary.timeSpan());
      out.println("  custodians: " + String.join(", ", summary.custodians()));
      out.println("  locations:  " + String.join(", ", summary.locations()));
      out.println("  actions:    " + String.join(", ", summary.actions()));
      out.println();
      for (var entry : system.custody().chain(documentId))
        out.println(
            "  " + entry.timestamp() + "  " + entry.action() + "  " + entry.userId() +
            entry.location().map(loc -> "  @" + loc).orElse(""));
    }
    out.flush();
  }

}


@Command(
    name = Suspicious.NAME,
    description = {
        "Runs the suspicious session activity heuristics",
        "Exits with code 1 if anything is found.",
        "",
    })
class Suspicious implements Callable<Integer> {

  final static String NAME = "suspicious";

  @ParentCommand
  private Audl audl;

  @Spec
  private CommandSpec spec;

  @Option(
      names = { "-u", "--user" },
      paramLabel = "USER_ID",
      description = "Check only the given user")
  private String userId;


  @Override
  public Integer call() {
    var out = spec.commandLine().getOut();
    List<Finding> findings;
    try (var system = audl.openSystem()) {
      findings = system.sessions().detectSuspiciousActivity(userId);
    }
    if (findings.isEmpty())
      out.println(Ansi.AUTO.string("[@|fg(green),bold CLEAR|@]: nothing suspicious"));
    for (var finding : findings) {
      var map = finding.toMap();
      map.remove("type");
      map.remove("user_id");
      map.remove("severity");
      map.remove("detected_at");
      out.println(Ansi.AUTO.string(
          "[@|fg(red),bold " + finding.severity().name() + "|@]: " +
          finding.type().code() + " by " + finding.userId() + " " + map));
    }
    out.flush();
    return findings.isEmpty() ? 0 : Audl.FAIL;
  }

}
