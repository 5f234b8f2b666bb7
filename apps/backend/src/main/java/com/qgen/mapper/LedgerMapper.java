package com.qgen.mapper;

import com.qgen.mapper.model.LedgerRecord;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

@Mapper
public interface LedgerMapper {

    int insertEntry(@Param("rec") LedgerRecord rec);

    List<LedgerRecord> selectChain(@Param("ledgerId") String ledgerId);

    LedgerRecord selectHead(@Param("ledgerId") String ledgerId);
}
