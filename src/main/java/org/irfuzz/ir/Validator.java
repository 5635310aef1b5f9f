/*
 * Copyright 2025 The Irfuzz Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.irfuzz.ir;

import com.google.common.collect.ImmutableList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Checks the structural rules that every module must satisfy:
 *
 * <ul>
 *   <li>each id is defined at most once;
 *   <li>each block ends with exactly one terminator, has its merge instruction (if any)
 *       immediately before the terminator, and has its value merges first;
 *   <li>each value merge has one incoming pair per predecessor;
 *   <li>each id operand refers to something defined, each label operand to a block of the same
 *       function;
 *   <li>in reachable blocks, each use of a function-local value is dominated by its definition
 *       (for a value merge, the definition must be available at the end of the predecessor).
 * </ul>
 */
public class Validator {

  private Validator() {}

  /** Returns a description of each problem found; the module is well-formed if it is empty. */
  public static ImmutableList<String> validate(Module module) {
    ImmutableList.Builder<String> problems = ImmutableList.builder();
    checkUniqueIds(module, problems);
    IrContext context = new IrContext(module);
    for (Function function : module.functions()) {
      if (function.blocks().isEmpty()) {
        problems.add("Function %" + function.id() + " has no blocks");
        continue;
      }
      for (Block block : function.blocks()) {
        checkBlockLayout(block, problems);
      }
      if (problems.build().isEmpty()) {
        for (Block block : function.blocks()) {
          checkOperands(context, function, block, problems);
        }
      }
    }
    return problems.build();
  }

  /** True if {@link #validate} finds no problems. */
  public static boolean isValid(Module module) {
    return validate(module).isEmpty();
  }

  private static void checkUniqueIds(Module module, ImmutableList.Builder<String> problems) {
    Set<Integer> seen = new HashSet<>();
    for (Instruction global : module.globals()) {
      checkNew(seen, global.resultId(), problems);
    }
    for (Function function : module.functions()) {
      checkNew(seen, function.id(), problems);
      for (Instruction param : function.params()) {
        checkNew(seen, param.resultId(), problems);
      }
      for (Block block : function.blocks()) {
        checkNew(seen, block.id(), problems);
        for (Instruction instruction : block.instructions()) {
          if (instruction.hasResultId()) {
            checkNew(seen, instruction.resultId(), problems);
          }
        }
      }
    }
    for (int id : seen) {
      if (id >= module.idBound()) {
        problems.add("Id %" + id + " is not below the id bound " + module.idBound());
      }
    }
  }

  private static void checkNew(Set<Integer> seen, int id, ImmutableList.Builder<String> problems) {
    if (!seen.add(id)) {
      problems.add("Id %" + id + " is defined more than once");
    }
  }

  private static void checkBlockLayout(Block block, ImmutableList.Builder<String> problems) {
    int size = block.size();
    if (block.terminator() == null) {
      problems.add("Block " + block + " does not end with a terminator");
      return;
    }
    int firstNonPhi = block.firstNonPhiIndex();
    for (int i = 0; i < size - 1; i++) {
      Opcode opcode = block.get(i).opcode();
      if (opcode.isTerminator()) {
        problems.add("Block " + block + " has a terminator before its end");
      } else if (opcode.category == Opcode.Category.MERGE && i != size - 2) {
        problems.add("Block " + block + " has a misplaced merge instruction");
      } else if (opcode == Opcode.PHI && i >= firstNonPhi) {
        problems.add("Block " + block + " has a value merge after other instructions");
      } else if (opcode.category == Opcode.Category.TYPE
          || (opcode.category == Opcode.Category.CONSTANT && opcode != Opcode.UNDEF)) {
        problems.add("Block " + block + " contains a global declaration");
      }
    }
    Instruction merge = block.mergeInstruction();
    if (merge != null && merge.opcode() == Opcode.SELECTION_MERGE
        && block.terminator().opcode() != Opcode.BRANCH_CONDITIONAL) {
      problems.add("Selection header " + block + " does not end in a conditional branch");
    }
  }

  private static void checkOperands(
      IrContext context, Function function, Block block, ImmutableList.Builder<String> problems) {
    DefUse defUse = context.defUse();
    Cfg cfg = context.cfg(function.id());
    DominatorTree doms = context.dominators(function.id());
    boolean reachable = cfg.isReachable(block.id());
    List<Integer> preds = cfg.predecessors(block.id());
    for (int index = 0; index < block.size(); index++) {
      Instruction instruction = block.get(index);
      Opcode opcode = instruction.opcode();
      if (opcode == Opcode.PHI) {
        Set<Integer> labels = new HashSet<>();
        for (int i = 1; i < instruction.numOperands(); i += 2) {
          labels.add(instruction.idOperand(i));
        }
        if (instruction.numOperands() % 2 != 0
            || instruction.numOperands() / 2 != preds.size()
            || !labels.equals(new HashSet<>(preds))) {
          problems.add(
              "Value merge " + instruction + " in " + block + " does not match predecessors "
                  + preds);
        }
      }
      if (instruction.typeId() != 0 && !defUse.isDefined(instruction.typeId())) {
        problems.add("Undefined type in " + instruction);
      }
      for (int i = 0; i < instruction.numOperands(); i++) {
        if (!instruction.operand(i).isId()) {
          continue;
        }
        int id = instruction.idOperand(i);
        if (opcode.isLabelOperand(i)) {
          if (function.findBlock(id) == null) {
            problems.add("Operand " + i + " of " + instruction + " is not a block of " + function);
          }
          continue;
        }
        if (!defUse.isDefined(id)) {
          problems.add("Operand " + i + " of " + instruction + " is undefined");
          continue;
        }
        Instruction def = defUse.def(id);
        if (!reachable || def == null) {
          continue;
        }
        if (defUse.functionOf(def) != null && defUse.functionOf(def) != function) {
          problems.add("Operand " + i + " of " + instruction + " is defined in another function");
          continue;
        }
        Block defBlock = defUse.blockOf(def);
        if (defBlock == null) {
          continue;
        }
        boolean available;
        if (opcode == Opcode.PHI) {
          int pred = (i + 1 < instruction.numOperands()) ? instruction.idOperand(i + 1) : 0;
          available = !cfg.isReachable(pred) || doms.dominates(defBlock.id(), pred);
        } else if (defBlock == block) {
          available = block.indexOf(def) < index;
        } else {
          available = doms.strictlyDominates(defBlock.id(), block.id());
        }
        if (!available) {
          problems.add("Definition of %" + id + " does not dominate its use in " + instruction);
        }
      }
    }
  }
}
