package com.lazytext.text;

import java.util.List;

/**
 * 有序组合多个行变换。
 *
 * pre 按列表顺序依次执行，post 按逆序执行；若每一步的 post 都是其 pre 的逆，
 * 则 post(pre(line)) 还原原始行。任一步骤抛出的异常直接向上传播。
 */
public class Pipeline implements LineTransform {

    private final List<LineTransform> steps;

    /**
     * 创建流水线。
     */
    public Pipeline(List<? extends LineTransform> steps) {
        if (steps == null) {
            throw new IllegalArgumentException("steps 不能为空");
        }
        this.steps = List.copyOf(steps);
    }

    public static Pipeline of(LineTransform... steps) {
        return new Pipeline(List.of(steps));
    }

    @Override
    public String pre(String line) {
        String current = line;
        for (LineTransform step : steps) {
            current = step.pre(current);
        }
        return current;
    }

    @Override
    public String post(String line) {
        String current = line;
        for (int index = steps.size() - 1; index >= 0; index--) {
            current = steps.get(index).post(current);
        }
        return current;
    }

    public List<LineTransform> steps() {
        return steps;
    }

    public int size() {
        return steps.size();
    }
}
