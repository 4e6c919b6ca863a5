package com.mk.fx.qa.loadster.cli;

import com.mk.fx.qa.loadster.dto.LoadTestRequest;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;
import org.kohsuke.args4j.Option;

/** Command-line options of a single load run. */
public class LoadsterCommandLine {

  @Option(name = "-u", aliases = "--url", required = true, usage = "The target URL for the load test")
  public String url;

  @Option(
      name = "-m",
      aliases = "--method",
      usage = "The HTTP method to use (default: GET). Supported methods: GET, POST, PUT, DELETE, PATCH")
  public String method = "GET";

  @Option(name = "-c", aliases = "--users", usage = "The number of concurrent users (default: 10)")
  public Integer users;

  @Option(
      name = "-t",
      aliases = "--timeout",
      usage = "The timeout for each request in seconds, or with a unit such as 500ms (default: 30)")
  public String timeout;

  @Option(name = "-H", aliases = "--header", usage = "Additional header 'Name: Value'; may be repeated")
  public List<String> headers = new ArrayList<>();

  @Option(name = "-b", aliases = "--body", usage = "The body of the request (for POST, PUT, PATCH methods)")
  public String body;

  @Option(name = "-v", aliases = "--verbose", usage = "Print the status of every request")
  public boolean verbose;

  @Option(name = "-o", aliases = "--output", usage = "Save the samples to a file, one JSON object per line")
  public String output;

  @Option(name = "-h", aliases = "--help", help = true, usage = "Show this help")
  public boolean help;

  /** True when the arguments ask for a command-line run rather than the HTTP service. */
  public static boolean isInvocation(String[] args) {
    return args != null
        && Arrays.stream(args)
            .anyMatch(
                arg ->
                    arg.equals("-u")
                        || arg.equals("--url")
                        || arg.startsWith("--url=")
                        || arg.equals("-h")
                        || arg.equals("--help"));
  }

  public static LoadsterCommandLine parse(String[] argv) throws CmdLineException {
    var options = new LoadsterCommandLine();
    new CmdLineParser(options).parseArgument(argv);
    return options;
  }

  public static void printUsage(PrintStream out) {
    out.println("Usage: loadster -u URL [options]");
    out.println(
        "Loadster sends concurrent HTTP requests to a web application and reports latency,"
            + " throughput and status codes.");
    new CmdLineParser(new LoadsterCommandLine()).printUsage(out);
  }

  /** Options as an inbound request; defaults for missing values are applied by the mapper. */
  public LoadTestRequest toRequest() {
    var request = new LoadTestRequest();
    request.setUrl(url);
    request.setMethod(method);
    request.setConcurrency(users);
    request.setTimeout(timeout);
    request.setHeaders(new ArrayList<>(headers));
    request.setBody(body);
    return request;
  }
}
