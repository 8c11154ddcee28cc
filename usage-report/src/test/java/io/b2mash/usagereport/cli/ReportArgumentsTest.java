package io.b2mash.usagereport.cli;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.usagereport.exception.InvalidReportArgumentsException;
import java.nio.file.Path;
import java.time.LocalDate;
import org.junit.jupiter.api.Test;

class ReportArgumentsTest {

  @Test
  void parse_shortOptions_readsGroupAndWindow() {
    var arguments = ReportArguments.parse("physics", "-S", "2024-01-01", "-E", "2024-03-31");

    assertThat(arguments.groupName()).isEqualTo("physics");
    assertThat(arguments.start()).isEqualTo(LocalDate.of(2024, 1, 1));
    assertThat(arguments.end()).isEqualTo(LocalDate.of(2024, 3, 31));
    assertThat(arguments.quotaFile()).isNull();
    assertThat(arguments.output()).isNull();
    assertThat(arguments.csv()).isFalse();
  }

  @Test
  void parse_longOptionsAndFlags_inAnyOrder() {
    var arguments =
        ReportArguments.parse(
            "--csv",
            "--end=2024-02-29",
            "--quota-file=/tmp/physics-quota.txt",
            "physics",
            "--start=2024-02-01",
            "--output=out/physics.pdf",
            "--html");

    assertThat(arguments.end()).isEqualTo(LocalDate.of(2024, 2, 29));
    assertThat(arguments.quotaFile()).isEqualTo(Path.of("/tmp/physics-quota.txt"));
    assertThat(arguments.output()).isEqualTo(Path.of("out/physics.pdf"));
    assertThat(arguments.csv()).isTrue();
    assertThat(arguments.html()).isTrue();
  }

  @Test
  void parse_configurationOverrides_areIgnored() {
    var arguments =
        ReportArguments.parse(
            "physics", "-S", "2024-01-01", "-E", "2024-01-31", "--usage-report.usage-top-n=3");

    assertThat(arguments.groupName()).isEqualTo("physics");
  }

  @Test
  void parse_missingGroup_isUsageError() {
    assertThatThrownBy(() -> ReportArguments.parse("-S", "2024-01-01", "-E", "2024-01-31"))
        .isInstanceOf(InvalidReportArgumentsException.class)
        .hasMessageContaining("Missing group name");
  }

  @Test
  void parse_twoGroups_isUsageError() {
    assertThatThrownBy(
            () ->
                ReportArguments.parse(
                    "physics", "chemistry", "-S", "2024-01-01", "-E", "2024-01-31"))
        .isInstanceOf(InvalidReportArgumentsException.class);
  }

  @Test
  void parse_badDate_isUsageError() {
    assertThatThrownBy(
            () -> ReportArguments.parse("physics", "-S", "01/01/2024", "-E", "2024-01-31"))
        .isInstanceOf(InvalidReportArgumentsException.class)
        .hasMessageContaining("01/01/2024");
  }

  @Test
  void parse_startAfterEnd_isUsageError() {
    assertThatThrownBy(
            () -> ReportArguments.parse("physics", "-S", "2024-02-01", "-E", "2024-01-01"))
        .isInstanceOf(InvalidReportArgumentsException.class)
        .hasMessageContaining("after");
  }

  @Test
  void parse_optionWithoutValue_isUsageError() {
    assertThatThrownBy(() -> ReportArguments.parse("physics", "-S", "2024-01-01", "-E"))
        .isInstanceOf(InvalidReportArgumentsException.class);
  }

  @Test
  void parse_unknownShortOption_isUsageError() {
    assertThatThrownBy(() -> ReportArguments.parse("physics", "-x"))
        .isInstanceOf(InvalidReportArgumentsException.class)
        .hasMessageContaining("-x");
  }
}
