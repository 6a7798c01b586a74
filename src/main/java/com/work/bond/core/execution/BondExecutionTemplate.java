package com.work.bond.core.execution;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Supplier;

import static com.work.bond.core.support.ValidationUtils.requireNonNull;

/**
 * 模板负责把一次状态变更调用包装成"全部成功或全部回滚"的事务。
 *
 * 职责：
 * 1. 全局串行：同一时刻只有一个状态变更调用在执行，调用内读到的容量/价格始终一致
 * 2. 执行前对所有参与者做 checkpoint，任何异常都按逆序回滚后原样抛出
 * 3. 嵌套调用（例如 teller 存款时调用 depository 发放奖励）加入外层事务，不单独提交
 * 4. 事务内登记的参与者随回滚注销
 */
public class BondExecutionTemplate {

    private final List<Revertible> participants = new CopyOnWriteArrayList<>();
    private final Object mutex = new Object();

    /**
     * 当前事务嵌套深度，仅在持有 mutex 时读写。
     */
    private int depth;

    public void register(Revertible participant) {
        participants.add(requireNonNull(participant, "participant"));
    }

    public void execute(Runnable work) {
        requireNonNull(work, "work");
        execute(() -> {
            work.run();
            return null;
        });
    }

    public <T> T execute(Supplier<T> work) {
        requireNonNull(work, "work");
        synchronized (mutex) {
            if (depth > 0) {
                // 已在事务中：加入外层事务，由外层负责回滚
                depth++;
                try {
                    return work.get();
                } finally {
                    depth--;
                }
            }

            List<Revertible> enlisted = new ArrayList<>(participants);
            List<Runnable> undo = new ArrayList<>(enlisted.size());
            for (Revertible participant : enlisted) {
                undo.add(participant.checkpoint());
            }
            depth = 1;
            try {
                return work.get();
            } catch (RuntimeException | Error ex) {
                for (int i = undo.size() - 1; i >= 0; i--) {
                    undo.get(i).run();
                }
                // 事务内新登记的参与者（例如创建失败的 teller）一并撤销
                participants.retainAll(enlisted);
                throw ex;
            } finally {
                depth = 0;
            }
        }
    }

    /**
     * 只读调用同样串行化，保证不会读到执行到一半的状态。
     */
    public <T> T read(Supplier<T> query) {
        synchronized (mutex) {
            return query.get();
        }
    }

    public int getParticipantCount() {
        return participants.size();
    }

    public boolean inTransaction() {
        synchronized (mutex) {
            return depth > 0;
        }
    }
}
