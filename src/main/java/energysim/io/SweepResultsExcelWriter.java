package energysim.io;

import energysim.config.ScenarioParameters;
import energysim.config.TunableParameter;
import energysim.config.TunableParameterPool;
import energysim.metrics.ScenarioMetric;
import energysim.sweep.SweepMode;
import energysim.sweep.SweepOutcome;
import energysim.sweep.SweepPlan;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.DataFormat;
import org.apache.poi.ss.usermodel.HorizontalAlignment;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.VerticalAlignment;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.StringJoiner;

/**
 * Выгрузка перебора параметров в .xlsx: лист RAW с точками и, для SWEEP_2,
 * лист SWEEP_2 с таблицами param1 × param2 по каждому показателю.
 */
public final class SweepResultsExcelWriter {

    public static final List<ScenarioMetric> DEFAULT_COLUMNS = List.of(
            ScenarioMetric.WARMING_2100,
            ScenarioMetric.PEAK_EMISSIONS_YEAR,
            ScenarioMetric.PEAK_EMISSIONS_GT,
            ScenarioMetric.DAMAGES_2100,
            ScenarioMetric.GRID_BELOW_100,
            ScenarioMetric.SOLAR_CROSSES_GAS,
            ScenarioMetric.ELEC_2050,
            ScenarioMetric.ENERGY_BURDEN_PEAK,
            ScenarioMetric.CAPITAL_STOCK_2100,
            ScenarioMetric.FOREST_LOSS);

    private SweepResultsExcelWriter() {}

    public static void writeXlsx(Path path,
                                 SweepPlan plan,
                                 ScenarioParameters baseParams,
                                 List<SweepOutcome> outcomes,
                                 List<ScenarioMetric> columns) throws IOException {

        if (plan.size() != outcomes.size()) {
            throw new IllegalArgumentException("plan.size != outcomes.size");
        }

        try (Workbook wb = new XSSFWorkbook()) {

            // ===== Styles =====
            DataFormat df = wb.createDataFormat();

            CellStyle passportStyle = wb.createCellStyle();
            passportStyle.setWrapText(false);
            passportStyle.setVerticalAlignment(VerticalAlignment.TOP);

            CellStyle headerStyle = wb.createCellStyle();
            headerStyle.setAlignment(HorizontalAlignment.CENTER);
            headerStyle.setVerticalAlignment(VerticalAlignment.CENTER);

            CellStyle centeredNumberStyle = wb.createCellStyle();
            centeredNumberStyle.setAlignment(HorizontalAlignment.CENTER);
            centeredNumberStyle.setVerticalAlignment(VerticalAlignment.CENTER);
            centeredNumberStyle.setDataFormat(df.getFormat("0.000"));

            // годы без дробной части
            CellStyle centeredIntStyle = wb.createCellStyle();
            centeredIntStyle.setAlignment(HorizontalAlignment.CENTER);
            centeredIntStyle.setVerticalAlignment(VerticalAlignment.CENTER);
            centeredIntStyle.setDataFormat(df.getFormat("0"));

            // ===== RAW sheet =====
            Sheet raw = wb.createSheet("RAW");

            int r = 0;

            Row row0 = raw.createRow(r++);
            Cell passportCell = row0.createCell(0);
            passportCell.setCellValue(buildPassport(plan, baseParams));
            passportCell.setCellStyle(passportStyle);

            // паспорт не задаёт ширину колонки A
            raw.setColumnWidth(0, 14 * 256);
            row0.setHeightInPoints(14);

            Row hdr = raw.createRow(r++);
            int c = 0;

            if (plan.getMode() == SweepMode.SWEEP_2) {
                c = writeHeader(hdr, c, plan.getParam1().name(), headerStyle);
                c = writeHeader(hdr, c, plan.getParam2().name(), headerStyle);
            } else if (plan.getMode() == SweepMode.SWEEP_1) {
                c = writeHeader(hdr, c, plan.getParam1().name(), headerStyle);
            }
            int firstMetricCol = c;
            for (ScenarioMetric m : columns) {
                c = writeHeader(hdr, c, m.key(), headerStyle);
            }

            for (int k = 0; k < outcomes.size(); k++) {
                SweepOutcome o = outcomes.get(k);

                Row rr = raw.createRow(r++);
                int cc = 0;

                if (plan.getMode() == SweepMode.SWEEP_2) {
                    writeNumber(rr, cc++, plan.value1(k), centeredNumberStyle);
                    writeNumber(rr, cc++, plan.value2(k), centeredNumberStyle);
                } else if (plan.getMode() == SweepMode.SWEEP_1) {
                    writeNumber(rr, cc++, plan.value1(k), centeredNumberStyle);
                }

                for (ScenarioMetric m : columns) {
                    CellStyle style = m.kind() == ScenarioMetric.Kind.YEAR ? centeredIntStyle : centeredNumberStyle;
                    writeNumber(rr, cc++, o.value(m), style);
                }
            }

            int rawCols = hdr.getLastCellNum();
            autosizeFrom(raw, rawCols, 1);

            // ===== SWEEP_2 grid =====
            if (plan.getMode() == SweepMode.SWEEP_2) {
                Sheet grid = wb.createSheet("SWEEP_2");
                double[] grid1 = plan.getGrid1();
                double[] grid2 = plan.getGrid2();

                int top = 0;
                for (int j = 0; j < columns.size(); j++) {
                    String col = colLetter(firstMetricCol + j + 1);
                    top = writeGridBlock(grid, columns.get(j).key(), top, grid1, grid2,
                            "RAW!$" + col + ":$" + col,
                            "RAW!$A:$A",
                            "RAW!$B:$B",
                            centeredNumberStyle,
                            headerStyle) + 2;
                }

                autosizeFrom(grid, Math.max(2, grid2.length + 1), 0);
            }

            try (OutputStream out = Files.newOutputStream(path)) {
                wb.write(out);
            }
        }
    }

    private static int writeHeader(Row hdr, int col, String text, CellStyle headerStyle) {
        Cell cell = hdr.createCell(col);
        cell.setCellValue(text);
        cell.setCellStyle(headerStyle);
        return col + 1;
    }

    private static void writeNumber(Row row, int col, double value, CellStyle numStyle) {
        Cell cell = row.createCell(col);
        if (Double.isFinite(value)) {
            cell.setCellValue(value);
        }
        cell.setCellStyle(numStyle);
    }

    private static int writeGridBlock(Sheet sh,
                                      String title,
                                      int topRow,
                                      double[] param1,
                                      double[] param2,
                                      String valueRange,
                                      String critRangeP1,
                                      String critRangeP2,
                                      CellStyle numStyle,
                                      CellStyle headerStyle) {

        Row t = sh.createRow(topRow++);
        Cell titleCell = t.createCell(0);
        titleCell.setCellValue(title);
        titleCell.setCellStyle(headerStyle);

        // param2 по горизонтали
        Row hdr = sh.createRow(topRow++);
        Cell corner = hdr.createCell(0);
        corner.setCellValue("");
        corner.setCellStyle(headerStyle);

        for (int j = 0; j < param2.length; j++) {
            Cell cell = hdr.createCell(1 + j);
            cell.setCellValue(param2[j]);
            cell.setCellStyle(headerStyle);
        }

        // param1 по вертикали + формулы
        int hdrExcel = topRow;
        for (int i = 0; i < param1.length; i++) {
            Row r = sh.createRow(topRow + i);

            Cell p1 = r.createCell(0);
            p1.setCellValue(param1[i]);
            p1.setCellStyle(headerStyle);

            int rowExcel = (topRow + i) + 1;

            for (int j = 0; j < param2.length; j++) {
                String colParam2 = colLetter(1 + j + 1);
                String f = "IFERROR(AVERAGEIFS(" + valueRange
                        + "," + critRangeP1 + ",$A" + rowExcel
                        + "," + critRangeP2 + "," + colParam2 + "$" + hdrExcel
                        + "),\"\")";

                Cell cell = r.createCell(1 + j);
                cell.setCellFormula(f);
                cell.setCellStyle(numStyle);
            }
        }

        return topRow + param1.length;
    }

    static String colLetter(int col1Based) {
        int col = col1Based;
        StringBuilder sb = new StringBuilder();
        while (col > 0) {
            int rem = (col - 1) % 26;
            sb.insert(0, (char) ('A' + rem));
            col = (col - 1) / 26;
        }
        return sb.toString();
    }

    private static void autosizeFrom(Sheet sh, int cols, int fromCol) {
        for (int i = fromCol; i < cols; i++) sh.autoSizeColumn(i);
    }

    static String buildPassport(SweepPlan plan, ScenarioParameters sp) {
        StringJoiner j = new StringJoiner("; ");
        j.add("mode=" + plan.getMode());
        for (TunableParameter p : TunableParameterPool.all()) {
            Double v = sp.get(p.id());
            if (v != null) {
                j.add(String.format(Locale.ROOT, "%s=%s", p.name(), v));
            }
        }
        return j.toString();
    }
}
