package ember.runtime.types;

import ember.runtime.EmberValue;

import java.util.List;

/**
 * 原生（宿主）函数入口
 */
@FunctionalInterface
public interface NativeFunction {

    EmberValue call(EmberValue self, List<EmberValue> args);
}
