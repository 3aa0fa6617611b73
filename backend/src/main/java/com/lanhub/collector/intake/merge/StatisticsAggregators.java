package com.lanhub.collector.intake.merge;

import com.lanhub.collector.config.CollectorProperties;
import com.lanhub.collector.intake.model.ColumnDefinition;
import com.lanhub.collector.intake.model.ColumnType;
import com.lanhub.collector.intake.model.MergeMode;
import org.springframework.stereotype.Component;

import java.math.RoundingMode;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Lookup table from (merge mode, column type) to the aggregation that produces statistics rows.
 * Accumulated text columns that other columns group by report their distinct-value count.
 */
@Component
public class StatisticsAggregators {
    static final String EMPTY_GROUP = "未填写";
    static final String VALUE_JOINER = "、";
    static final String GROUP_SEPARATOR = "：";

    private final Map<MergeMode, EnumMap<ColumnType, FieldAggregator>> table = new EnumMap<>(MergeMode.class);
    private final String defaultGroupField;

    public StatisticsAggregators(CollectorProperties properties) {
        this.defaultGroupField = properties.getMerge().getDefaultGroupByField();

        EnumMap<ColumnType, FieldAggregator> accumulate = new EnumMap<>(ColumnType.class);
        accumulate.put(ColumnType.NUMBER, this::accumulateNumber);
        accumulate.put(ColumnType.BOOLEAN, this::accumulateBoolean);
        accumulate.put(ColumnType.TEXT, this::accumulateText);
        table.put(MergeMode.ACCUMULATE, accumulate);

        EnumMap<ColumnType, FieldAggregator> groupBy = new EnumMap<>(ColumnType.class);
        groupBy.put(ColumnType.NUMBER, this::groupNumber);
        groupBy.put(ColumnType.BOOLEAN, this::groupBoolean);
        groupBy.put(ColumnType.TEXT, this::groupText);
        table.put(MergeMode.GROUP_BY, groupBy);
    }

    public FieldAggregator forColumn(ColumnDefinition column, Set<String> groupingFields) {
        if (column.mergeMode() == MergeMode.ACCUMULATE
            && column.type() == ColumnType.TEXT
            && groupingFields.contains(column.name())) {
            return this::summarizeGroupingText;
        }
        return table.get(column.mergeMode()).get(column.type());
    }

    public List<StatisticsRow> aggregate(
        ColumnDefinition column,
        List<Map<String, FieldValue>> records,
        Set<String> groupingFields
    ) {
        return forColumn(column, groupingFields).aggregate(column, records);
    }

    public String defaultGroupField() {
        return defaultGroupField;
    }

    private List<StatisticsRow> accumulateNumber(ColumnDefinition column, List<Map<String, FieldValue>> records) {
        double sum = 0;
        for (Map<String, FieldValue> record : records) {
            OptionalDouble number = value(record, column.name()).asNumber();
            if (number.isPresent()) {
                sum += number.getAsDouble();
            }
        }
        return List.of(row(column, records, formatNumber(sum), ""));
    }

    private List<StatisticsRow> accumulateBoolean(ColumnDefinition column, List<Map<String, FieldValue>> records) {
        int yes = 0;
        int no = 0;
        for (Map<String, FieldValue> record : records) {
            Optional<Boolean> flag = value(record, column.name()).asBoolean();
            if (flag.isPresent()) {
                if (flag.get()) {
                    yes++;
                } else {
                    no++;
                }
            }
        }
        return List.of(row(column, records, formatYesNo(yes, no), ""));
    }

    private List<StatisticsRow> accumulateText(ColumnDefinition column, List<Map<String, FieldValue>> records) {
        return List.of(row(column, records, String.join(VALUE_JOINER, distinctText(column, records)), ""));
    }

    private List<StatisticsRow> summarizeGroupingText(ColumnDefinition column, List<Map<String, FieldValue>> records) {
        Set<String> distinct = distinctText(column, records);
        return List.of(row(column, records, "共 " + distinct.size() + " 个不同值", String.join(VALUE_JOINER, distinct)));
    }

    private static Set<String> distinctText(ColumnDefinition column, List<Map<String, FieldValue>> records) {
        Set<String> distinct = new LinkedHashSet<>();
        for (Map<String, FieldValue> record : records) {
            String text = value(record, column.name()).asText();
            if (!text.isBlank()) {
                distinct.add(text);
            }
        }
        return distinct;
    }

    private List<StatisticsRow> groupNumber(ColumnDefinition column, List<Map<String, FieldValue>> records) {
        String groupField = groupField(column);
        Map<String, Double> sums = new LinkedHashMap<>();
        for (Map<String, FieldValue> record : records) {
            OptionalDouble number = value(record, column.name()).asNumber();
            if (number.isPresent()) {
                sums.merge(groupOf(record, groupField), number.getAsDouble(), Double::sum);
            }
        }
        List<StatisticsRow> rows = new ArrayList<>(sums.size());
        sums.forEach((group, sum) -> rows.add(row(column, records, formatNumber(sum), group + GROUP_SEPARATOR + formatNumber(sum))));
        return rows;
    }

    private List<StatisticsRow> groupBoolean(ColumnDefinition column, List<Map<String, FieldValue>> records) {
        String groupField = groupField(column);
        Map<String, int[]> counts = new LinkedHashMap<>();
        for (Map<String, FieldValue> record : records) {
            Optional<Boolean> flag = value(record, column.name()).asBoolean();
            if (flag.isEmpty()) {
                continue;
            }
            int[] yesNo = counts.computeIfAbsent(groupOf(record, groupField), ignored -> new int[2]);
            yesNo[flag.get() ? 0 : 1]++;
        }
        List<StatisticsRow> rows = new ArrayList<>(counts.size());
        counts.forEach((group, yesNo) -> rows.add(row(
            column,
            records,
            formatYesNo(yesNo[0], yesNo[1]),
            group + GROUP_SEPARATOR + formatYesNo(yesNo[0], yesNo[1])
        )));
        return rows;
    }

    private List<StatisticsRow> groupText(ColumnDefinition column, List<Map<String, FieldValue>> records) {
        String groupField = groupField(column);
        Map<String, List<String>> values = new LinkedHashMap<>();
        for (Map<String, FieldValue> record : records) {
            String text = value(record, column.name()).asText();
            if (!text.isBlank()) {
                values.computeIfAbsent(groupOf(record, groupField), ignored -> new ArrayList<>()).add(text);
            }
        }
        List<StatisticsRow> rows = new ArrayList<>(values.size());
        values.forEach((group, all) -> rows.add(row(
            column,
            records,
            String.join(VALUE_JOINER, new LinkedHashSet<>(all)),
            group + GROUP_SEPARATOR + String.join(VALUE_JOINER, all)
        )));
        return rows;
    }

    private String groupField(ColumnDefinition column) {
        String field = column.groupByField();
        return field == null || field.isBlank() ? defaultGroupField : field;
    }

    private String groupOf(Map<String, FieldValue> record, String groupField) {
        String group = value(record, groupField).asText().trim();
        return group.isEmpty() ? EMPTY_GROUP : group;
    }

    private static FieldValue value(Map<String, FieldValue> record, String field) {
        FieldValue value = record.get(field);
        return value == null ? FieldValue.NullValue.INSTANCE : value;
    }

    private static StatisticsRow row(
        ColumnDefinition column,
        List<Map<String, FieldValue>> records,
        String result,
        String detail
    ) {
        return new StatisticsRow(column.name(), column.type().label(), records.size(), result, detail);
    }

    static String formatNumber(double value) {
        DecimalFormat format = new DecimalFormat("0.##", DecimalFormatSymbols.getInstance(Locale.ROOT));
        format.setRoundingMode(RoundingMode.HALF_UP);
        return format.format(value);
    }

    static String formatYesNo(int yes, int no) {
        return "是(" + yes + ") 否(" + no + ")";
    }
}
